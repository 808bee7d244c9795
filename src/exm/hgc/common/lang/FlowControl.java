package exm.hgc.common.lang;

/**
 * Handshake discipline of a channel.  Legalization never changes it.
 */
public enum FlowControl {
  READY_VALID("ready_valid"),
  NONE("none");

  private final String text;

  private FlowControl(String text) {
    this.text = text;
  }

  public String text() {
    return text;
  }

  public static FlowControl fromString(String text) {
    for (FlowControl f: values()) {
      if (f.text.equals(text)) {
        return f;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return text;
  }
}

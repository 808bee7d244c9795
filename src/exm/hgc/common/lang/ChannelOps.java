package exm.hgc.common.lang;

/**
 * Which operations a channel supports
 */
public enum ChannelOps {
  SEND_ONLY("send_only"),
  RECEIVE_ONLY("receive_only"),
  SEND_RECEIVE("send_receive");

  private final String text;

  private ChannelOps(String text) {
    this.text = text;
  }

  public String text() {
    return text;
  }

  public boolean supportsSend() {
    return this != RECEIVE_ONLY;
  }

  public boolean supportsReceive() {
    return this != SEND_ONLY;
  }

  public static ChannelOps fromString(String text) {
    for (ChannelOps o: values()) {
      if (o.text.equals(text)) {
        return o;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return text;
  }
}

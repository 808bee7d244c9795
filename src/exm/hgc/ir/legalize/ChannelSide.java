package exm.hgc.ir.legalize;

import exm.hgc.ir.tree.Opcode;

public enum ChannelSide {
  SEND(Opcode.SEND, "send"),
  RECEIVE(Opcode.RECEIVE, "receive");

  private final Opcode opcode;
  private final String text;

  private ChannelSide(Opcode opcode, String text) {
    this.opcode = opcode;
    this.text = text;
  }

  public Opcode opcode() {
    return opcode;
  }

  @Override
  public String toString() {
    return text;
  }
}

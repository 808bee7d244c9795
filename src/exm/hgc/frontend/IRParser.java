/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.hgc.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.hgc.common.exceptions.InvalidSyntaxException;
import exm.hgc.common.exceptions.TypeMismatchException;
import exm.hgc.common.exceptions.UserException;
import exm.hgc.common.lang.ChannelOps;
import exm.hgc.common.lang.ChannelStrictness;
import exm.hgc.common.lang.FlowControl;
import exm.hgc.common.lang.Types;
import exm.hgc.common.lang.Types.Type;
import exm.hgc.common.lang.Value;
import exm.hgc.frontend.IRLexer.Token;
import exm.hgc.frontend.IRLexer.TokenKind;
import exm.hgc.ir.tree.Channel;
import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Opcode;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.ProcBuilder;
import exm.hgc.ir.tree.Program;

/**
 * Recursive descent parser for IR text.
 *
 * Accepts everything the printer emits, plus some laxity in the input:
 * keyword arguments in any order, plain or triple-quoted metadata, and
 * ignored <code>id=</code> attributes on nodes.
 */
public class IRParser {

  /** Keyword arguments accepted by each operation, besides id */
  private static final Map<Opcode, Set<String>> KEYWORDS =
                                new HashMap<Opcode, Set<String>>();
  static {
    for (Opcode op: Opcode.values()) {
      KEYWORDS.put(op, new HashSet<String>());
    }
    KEYWORDS.get(Opcode.LITERAL).add("value");
    KEYWORDS.get(Opcode.TUPLE_INDEX).add("index");
    KEYWORDS.get(Opcode.BIT_SLICE).addAll(Arrays.asList("start", "width"));
    KEYWORDS.get(Opcode.SEL).add("cases");
    KEYWORDS.get(Opcode.RECEIVE).addAll(
                    Arrays.asList("predicate", "channel_id"));
    KEYWORDS.get(Opcode.SEND).addAll(
                    Arrays.asList("predicate", "channel_id"));
    KEYWORDS.get(Opcode.ASSERT).addAll(Arrays.asList("message", "label"));
  }

  private final String file;
  private final List<Token> tokens;
  private int pos = 0;

  private IRParser(String file, List<Token> tokens) {
    this.file = file;
    this.tokens = tokens;
  }

  public static Program parse(String text) throws UserException {
    return parse("<string>", text);
  }

  public static Program parse(String file, String text)
      throws UserException {
    IRLexer lexer = new IRLexer(file, text);
    List<Token> tokens = new ArrayList<Token>();
    Token t;
    do {
      t = lexer.next();
      tokens.add(t);
    } while (t.kind != TokenKind.EOF);
    return new IRParser(file, tokens).program();
  }

  private Program program() throws UserException {
    expectKeyword("package");
    Program program = new Program(ident());

    while (peek().kind != TokenKind.EOF) {
      Token t = peek();
      if (isKeyword(t, "chan")) {
        channel(program);
      } else if (isKeyword(t, "top") || isKeyword(t, "proc")) {
        proc(program);
      } else {
        throw error(t, "Expected channel or proc declaration, found " + t);
      }
    }
    return program;
  }

  private void channel(Program program) throws UserException {
    expectKeyword("chan");
    Token nameTok = expect(TokenKind.IDENT);
    expect(TokenKind.LPAREN);
    Type type = type();

    Integer id = null;
    ChannelOps ops = ChannelOps.SEND_RECEIVE;
    FlowControl flowControl = FlowControl.READY_VALID;
    ChannelStrictness strictness = ChannelStrictness.DEFAULT;
    String metadata = "";
    while (accept(TokenKind.COMMA)) {
      Token key = expect(TokenKind.IDENT);
      expect(TokenKind.EQUALS);
      if (key.text.equals("id")) {
        id = intValue(expect(TokenKind.NUMBER));
      } else if (key.text.equals("kind")) {
        Token kind = expect(TokenKind.IDENT);
        if (!kind.text.equals("streaming")) {
          throw error(kind, "Unsupported channel kind: " + kind.text);
        }
      } else if (key.text.equals("ops")) {
        Token t = expect(TokenKind.IDENT);
        ops = ChannelOps.fromString(t.text);
        if (ops == null) {
          throw error(t, "Unknown channel ops: " + t.text);
        }
      } else if (key.text.equals("flow_control")) {
        Token t = expect(TokenKind.IDENT);
        flowControl = FlowControl.fromString(t.text);
        if (flowControl == null) {
          throw error(t, "Unknown flow control: " + t.text);
        }
      } else if (key.text.equals("strictness")) {
        Token t = expect(TokenKind.IDENT);
        strictness = ChannelStrictness.fromString(t.text);
        if (strictness == null) {
          throw error(t, "Unknown channel strictness: " + t.text);
        }
      } else if (key.text.equals("metadata")) {
        metadata = expect(TokenKind.STRING).text;
      } else {
        throw error(key, "Unknown channel attribute: " + key.text);
      }
    }
    expect(TokenKind.RPAREN);

    if (id == null) {
      throw error(nameTok, "Channel " + nameTok.text + " has no id");
    }
    if (program.lookupChannel(id) != null) {
      throw error(nameTok, "Duplicate channel id " + id);
    }
    if (program.channelByName(nameTok.text) != null) {
      throw error(nameTok, "Duplicate channel name " + nameTok.text);
    }
    program.addChannel(new Channel(nameTok.text, id, type, ops,
                                   flowControl, strictness, metadata));
  }

  private void proc(Program program) throws UserException {
    boolean top = false;
    if (isKeyword(peek(), "top")) {
      next();
      top = true;
    }
    expectKeyword("proc");
    Token nameTok = expect(TokenKind.IDENT);
    if (program.proc(nameTok.text) != null) {
      throw error(nameTok, "Duplicate proc name " + nameTok.text);
    }
    expect(TokenKind.LPAREN);

    List<Token> paramNames = new ArrayList<Token>();
    List<Type> paramTypes = new ArrayList<Type>();
    List<Value> init = null;
    while (true) {
      Token t = expect(TokenKind.IDENT);
      if (t.text.equals("init") && peek().kind == TokenKind.EQUALS) {
        next();
        if (paramTypes.isEmpty()) {
          throw error(t, "Proc " + nameTok.text + " has no token parameter");
        }
        init = initValues(t, paramTypes.subList(1, paramTypes.size()));
        break;
      }
      expect(TokenKind.COLON);
      paramNames.add(t);
      paramTypes.add(type());
      expect(TokenKind.COMMA);
    }
    expect(TokenKind.RPAREN);

    if (!paramTypes.get(0).isToken()) {
      throw new TypeMismatchException(file, paramNames.get(0).line,
          paramNames.get(0).col, "First parameter of proc " + nameTok.text
          + " must be a token but has type " + paramTypes.get(0));
    }

    Proc proc = new Proc(nameTok.text);
    ProcBuilder builder = new ProcBuilder(program, proc);
    builder.tokenParam(paramNames.get(0).text);
    for (int i = 1; i < paramNames.size(); i++) {
      checkFreshName(proc, paramNames.get(i));
      builder.stateParam(paramNames.get(i).text, paramTypes.get(i),
                         init.get(i - 1));
    }

    expect(TokenKind.LBRACE);
    while (true) {
      Token t = expect(TokenKind.IDENT);
      if (t.text.equals("next") && peek().kind == TokenKind.LPAREN) {
        nextStatement(t, proc);
        break;
      }
      node(builder, t);
    }
    expect(TokenKind.RBRACE);

    program.addProc(proc);
    if (top) {
      if (program.topProc() != null) {
        throw error(nameTok, "Multiple top procs: " + program.topProc()
                             + " and " + nameTok.text);
      }
      program.setTopProc(nameTok.text);
    }
  }

  private List<Value> initValues(Token initTok, List<Type> stateTypes)
      throws UserException {
    expect(TokenKind.LBRACE);
    List<Value> result = new ArrayList<Value>();
    if (peek().kind != TokenKind.RBRACE) {
      do {
        if (result.size() >= stateTypes.size()) {
          throw error(peek(), "More initial values than state parameters");
        }
        result.add(value(stateTypes.get(result.size())));
      } while (accept(TokenKind.COMMA));
    }
    expect(TokenKind.RBRACE);
    if (result.size() != stateTypes.size()) {
      throw error(initTok, "Expected " + stateTypes.size() +
                  " initial values but found " + result.size());
    }
    return result;
  }

  private void nextStatement(Token nextTok, Proc proc) throws UserException {
    expect(TokenKind.LPAREN);
    List<Integer> handles = new ArrayList<Integer>();
    do {
      handles.add(nodeRef(proc, expect(TokenKind.IDENT)));
    } while (accept(TokenKind.COMMA));
    expect(TokenKind.RPAREN);

    int stateCount = proc.stateParams().size();
    if (handles.size() != stateCount + 1) {
      throw error(nextTok, "next of proc " + proc.name() + " has " +
          (handles.size() - 1) + " state values but proc has " +
          stateCount + " state parameters");
    }
    if (!proc.node(handles.get(0)).type().isToken()) {
      throw new TypeMismatchException(file, nextTok.line, nextTok.col,
          "First operand of next must be a token in proc " + proc.name());
    }
    for (int i = 0; i < stateCount; i++) {
      Type expected = proc.node(proc.stateParams().get(i)).type();
      Type actual = proc.node(handles.get(i + 1)).type();
      if (!expected.equals(actual)) {
        throw new TypeMismatchException(file, nextTok.line, nextTok.col,
            "Next state value " + proc.node(handles.get(i + 1)).name() +
            " has type " + actual + " but state has type " + expected);
      }
    }
    proc.setNext(handles.get(0), handles.subList(1, handles.size()));
  }

  /** Keyword argument: either a token, a list of names or a value */
  private static class KeywordArg {
    final Token key;
    Token token;
    List<Token> list;
    Value value;

    KeywordArg(Token key) {
      this.key = key;
    }
  }

  private void node(ProcBuilder builder, Token nameTok)
      throws UserException {
    Proc proc = builder.proc();
    checkFreshName(proc, nameTok);
    expect(TokenKind.COLON);
    Type declared = type();
    expect(TokenKind.EQUALS);
    Token opTok = expect(TokenKind.IDENT);
    Opcode op = Opcode.fromIRName(opTok.text);
    if (op == null) {
      throw error(opTok, "Unknown operation: " + opTok.text);
    }

    List<Integer> args = new ArrayList<Integer>();
    Map<String, KeywordArg> kws = new HashMap<String, KeywordArg>();
    expect(TokenKind.LPAREN);
    if (peek().kind != TokenKind.RPAREN) {
      do {
        Token t = next();
        if (t.kind == TokenKind.IDENT && accept(TokenKind.EQUALS)) {
          KeywordArg kw = keywordArg(t, op, declared);
          if (kws.containsKey(t.text)) {
            throw error(t, "Duplicate keyword argument " + t.text);
          }
          if (!t.text.equals("id")) {
            kws.put(t.text, kw);
          }
        } else if (t.kind == TokenKind.IDENT) {
          if (!kws.isEmpty()) {
            throw error(t, "Positional operand after keyword arguments");
          }
          args.add(nodeRef(proc, t));
        } else {
          throw error(t, "Expected operand, found " + t);
        }
      } while (accept(TokenKind.COMMA));
    }
    expect(TokenKind.RPAREN);

    Node n;
    try {
      n = build(builder, nameTok, opTok, op, args, kws);
    } catch (TypeMismatchException e) {
      throw new TypeMismatchException(file, nameTok.line, nameTok.col,
                                      e.getMessage());
    }
    if (!n.type().equals(declared)) {
      throw new TypeMismatchException(file, nameTok.line, nameTok.col,
          "Node " + nameTok.text + " declared with type " + declared +
          " but has type " + n.type());
    }
  }

  private KeywordArg keywordArg(Token key, Opcode op, Type declared)
      throws UserException {
    if (!key.text.equals("id") && !KEYWORDS.get(op).contains(key.text)) {
      throw error(key, "Unknown keyword argument " + key.text +
                  " for " + op.irName());
    }
    KeywordArg kw = new KeywordArg(key);
    if (key.text.equals("value")) {
      kw.value = value(declared);
    } else if (accept(TokenKind.LBRACKET)) {
      kw.list = new ArrayList<Token>();
      if (peek().kind != TokenKind.RBRACKET) {
        do {
          kw.list.add(expect(TokenKind.IDENT));
        } while (accept(TokenKind.COMMA));
      }
      expect(TokenKind.RBRACKET);
    } else {
      Token t = next();
      if (t.kind != TokenKind.IDENT && t.kind != TokenKind.NUMBER &&
          t.kind != TokenKind.STRING) {
        throw error(t, "Expected value for " + key.text + ", found " + t);
      }
      kw.token = t;
    }
    return kw;
  }

  private Node build(ProcBuilder builder, Token nameTok, Token opTok,
      Opcode op, List<Integer> args, Map<String, KeywordArg> kws)
          throws UserException {
    Proc proc = builder.proc();
    String name = nameTok.text;
    switch (op) {
      case LITERAL:
        checkOperandCount(opTok, args, 0);
        return builder.literal(name, required(opTok, kws, "value").value);
      case TUPLE:
        return builder.tuple(name, args);
      case TUPLE_INDEX:
        checkOperandCount(opTok, args, 1);
        return builder.tupleIndex(name, args.get(0),
                                  intKeyword(opTok, kws, "index"));
      case BIT_SLICE:
        checkOperandCount(opTok, args, 1);
        return builder.bitSlice(name, args.get(0),
            intKeyword(opTok, kws, "start"), intKeyword(opTok, kws, "width"));
      case NOT:
        checkOperandCount(opTok, args, 1);
        return builder.not(name, args.get(0));
      case SEL: {
        checkOperandCount(opTok, args, 1);
        KeywordArg cases = required(opTok, kws, "cases");
        if (cases.list == null || cases.list.size() != 2) {
          throw error(cases.key, "sel requires exactly two cases");
        }
        return builder.sel(name, args.get(0),
                           nodeRef(proc, cases.list.get(0)),
                           nodeRef(proc, cases.list.get(1)));
      }
      case AFTER_ALL:
        return builder.afterAll(name, args);
      case RECEIVE:
        checkOperandCount(opTok, args, 1);
        return builder.receive(name, args.get(0), predicate(proc, kws),
                               intKeyword(opTok, kws, "channel_id"));
      case SEND:
        checkOperandCount(opTok, args, 2);
        return builder.send(name, args.get(0), args.get(1),
                            predicate(proc, kws),
                            intKeyword(opTok, kws, "channel_id"));
      case ASSERT: {
        checkOperandCount(opTok, args, 2);
        String message = stringKeyword(opTok, kws, "message");
        String label = kws.containsKey("label") ?
                          stringKeyword(opTok, kws, "label") : "";
        return builder.assertion(name, args.get(0), args.get(1),
                                 message, label);
      }
      default:
        if (op.isBitwiseNary() || op.isComparison() ||
            op == Opcode.ADD || op == Opcode.SUB) {
          return builder.nary(name, op, args);
        }
        throw error(opTok, "Operation cannot appear in IR text: "
                           + opTok.text);
    }
  }

  private Integer predicate(Proc proc, Map<String, KeywordArg> kws)
      throws UserException {
    KeywordArg kw = kws.get("predicate");
    if (kw == null) {
      return null;
    }
    if (kw.token == null || kw.token.kind != TokenKind.IDENT) {
      throw error(kw.key, "Predicate must name a node");
    }
    return nodeRef(proc, kw.token);
  }

  private KeywordArg required(Token opTok, Map<String, KeywordArg> kws,
                              String key) throws InvalidSyntaxException {
    KeywordArg kw = kws.get(key);
    if (kw == null) {
      throw error(opTok, opTok.text + " requires keyword argument " + key);
    }
    return kw;
  }

  private int intKeyword(Token opTok, Map<String, KeywordArg> kws,
                         String key) throws InvalidSyntaxException {
    KeywordArg kw = required(opTok, kws, key);
    if (kw.token == null || kw.token.kind != TokenKind.NUMBER) {
      throw error(kw.key, key + " must be an integer");
    }
    return intValue(kw.token);
  }

  private String stringKeyword(Token opTok, Map<String, KeywordArg> kws,
                               String key) throws InvalidSyntaxException {
    KeywordArg kw = required(opTok, kws, key);
    if (kw.token == null || kw.token.kind != TokenKind.STRING) {
      throw error(kw.key, key + " must be a string");
    }
    return kw.token.text;
  }

  private void checkOperandCount(Token opTok, List<Integer> args,
                                 int expected) throws InvalidSyntaxException {
    if (args.size() != expected) {
      throw error(opTok, opTok.text + " expects " + expected +
                  " operands but has " + args.size());
    }
  }

  private int nodeRef(Proc proc, Token t) throws InvalidSyntaxException {
    Node n = proc.nodeByName(t.text);
    if (n == null) {
      throw error(t, "Undefined node " + t.text + " in proc " + proc.name());
    }
    return n.id();
  }

  private void checkFreshName(Proc proc, Token t)
      throws InvalidSyntaxException {
    if (proc.nodeByName(t.text) != null) {
      throw error(t, "Duplicate node name " + t.text + " in proc "
                     + proc.name());
    }
  }

  private Type type() throws UserException {
    Token t = next();
    if (t.kind == TokenKind.LPAREN) {
      List<Type> elems = new ArrayList<Type>();
      if (peek().kind != TokenKind.RPAREN) {
        do {
          elems.add(type());
        } while (accept(TokenKind.COMMA));
      }
      expect(TokenKind.RPAREN);
      return Types.tuple(elems);
    } else if (isKeyword(t, "token")) {
      return Types.TOKEN;
    } else if (isKeyword(t, "bits")) {
      expect(TokenKind.LBRACKET);
      Token width = expect(TokenKind.NUMBER);
      expect(TokenKind.RBRACKET);
      int w = intValue(width);
      if (w < 1 || w > Types.MAX_BITS) {
        throw error(width, "Unsupported bit width " + w);
      }
      return Types.bits(w);
    }
    throw error(t, "Expected type, found " + t);
  }

  /**
   * Parse a value of a known type
   */
  private Value value(Type type) throws UserException {
    Token t = peek();
    switch (type.kind()) {
      case BITS: {
        expect(TokenKind.NUMBER);
        long v = longValue(t);
        if ((v & ~Value.mask(type.bitCount())) != 0) {
          throw new TypeMismatchException(file, t.line, t.col, "Value "
                            + t.text + " does not fit in " + type);
        }
        return Value.bits(type.bitCount(), v);
      }
      case TOKEN:
        expectKeyword("token");
        return Value.token();
      case TUPLE: {
        expect(TokenKind.LPAREN);
        List<Value> elems = new ArrayList<Value>();
        List<Type> elemTypes = type.elements();
        for (int i = 0; i < elemTypes.size(); i++) {
          if (i > 0) {
            expect(TokenKind.COMMA);
          }
          elems.add(value(elemTypes.get(i)));
        }
        expect(TokenKind.RPAREN);
        return Value.tuple(elems);
      }
      default:
        throw error(t, "Unsupported value type " + type);
    }
  }

  private long longValue(Token t) throws InvalidSyntaxException {
    String s = t.text.replace("_", "");
    try {
      if (s.startsWith("0x")) {
        return Long.parseUnsignedLong(s.substring(2), 16);
      } else if (s.startsWith("0b")) {
        return Long.parseUnsignedLong(s.substring(2), 2);
      }
      return Long.parseUnsignedLong(s);
    } catch (NumberFormatException e) {
      throw error(t, "Invalid number " + t.text);
    }
  }

  private int intValue(Token t) throws InvalidSyntaxException {
    long v = longValue(t);
    if (v < 0 || v > Integer.MAX_VALUE) {
      throw error(t, "Number out of range: " + t.text);
    }
    return (int)v;
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token next() {
    Token t = tokens.get(pos);
    if (t.kind != TokenKind.EOF) {
      pos++;
    }
    return t;
  }

  private boolean accept(TokenKind kind) {
    if (peek().kind == kind) {
      next();
      return true;
    }
    return false;
  }

  private Token expect(TokenKind kind) throws InvalidSyntaxException {
    Token t = next();
    if (t.kind != kind) {
      throw error(t, "Expected " + kind.toString().toLowerCase() +
                     ", found " + t);
    }
    return t;
  }

  private String ident() throws InvalidSyntaxException {
    return expect(TokenKind.IDENT).text;
  }

  private void expectKeyword(String keyword) throws InvalidSyntaxException {
    Token t = next();
    if (!isKeyword(t, keyword)) {
      throw error(t, "Expected '" + keyword + "', found " + t);
    }
  }

  private static boolean isKeyword(Token t, String keyword) {
    return t.kind == TokenKind.IDENT && t.text.equals(keyword);
  }

  private InvalidSyntaxException error(Token t, String msg) {
    return new InvalidSyntaxException(file, t.line, t.col, msg);
  }
}

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

import exm.hgc.common.exceptions.InvalidSyntaxException;

/**
 * Splits IR text into tokens, tracking line and column.
 */
public class IRLexer {

  public static enum TokenKind {
    IDENT,
    NUMBER,
    STRING,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    COLON,
    EQUALS,
    EOF,
  }

  public static class Token {
    public final TokenKind kind;
    public final String text;
    public final int line;
    public final int col;

    public Token(TokenKind kind, String text, int line, int col) {
      this.kind = kind;
      this.text = text;
      this.line = line;
      this.col = col;
    }

    @Override
    public String toString() {
      return kind == TokenKind.EOF ? "end of input" : "'" + text + "'";
    }
  }

  private final String file;
  private final String input;
  private int pos = 0;
  private int line = 1;
  private int col = 0;

  public IRLexer(String file, String input) {
    this.file = file;
    this.input = input;
  }

  public String file() {
    return file;
  }

  public Token next() throws InvalidSyntaxException {
    skipWhitespaceAndComments();
    if (pos >= input.length()) {
      return new Token(TokenKind.EOF, "", line, col);
    }
    int startLine = line;
    int startCol = col;
    char c = input.charAt(pos);
    switch (c) {
      case '(': return punct(TokenKind.LPAREN);
      case ')': return punct(TokenKind.RPAREN);
      case '[': return punct(TokenKind.LBRACKET);
      case ']': return punct(TokenKind.RBRACKET);
      case '{': return punct(TokenKind.LBRACE);
      case '}': return punct(TokenKind.RBRACE);
      case ',': return punct(TokenKind.COMMA);
      case ':': return punct(TokenKind.COLON);
      case '=': return punct(TokenKind.EQUALS);
      case '"': return string(startLine, startCol);
      default:
        break;
    }
    if (Character.isDigit(c)) {
      int start = pos;
      while (pos < input.length() &&
             (Character.isLetterOrDigit(input.charAt(pos)) ||
              input.charAt(pos) == '_')) {
        advance();
      }
      return new Token(TokenKind.NUMBER, input.substring(start, pos),
                       startLine, startCol);
    }
    if (isIdentStart(c)) {
      int start = pos;
      while (pos < input.length() && isIdentPart(input.charAt(pos))) {
        advance();
      }
      return new Token(TokenKind.IDENT, input.substring(start, pos),
                       startLine, startCol);
    }
    throw new InvalidSyntaxException(file, startLine, startCol,
                                     "Unexpected character '" + c + "'");
  }

  private Token punct(TokenKind kind) {
    Token t = new Token(kind, String.valueOf(input.charAt(pos)), line, col);
    advance();
    return t;
  }

  /**
   * Plain "..." strings with backslash escapes, or """...""" strings
   * taken verbatim
   */
  private Token string(int startLine, int startCol)
      throws InvalidSyntaxException {
    StringBuilder sb = new StringBuilder();
    if (input.startsWith("\"\"\"", pos)) {
      advance(3);
      int end = input.indexOf("\"\"\"", pos);
      if (end < 0) {
        throw new InvalidSyntaxException(file, startLine, startCol,
                                         "Unterminated string");
      }
      while (pos < end) {
        sb.append(input.charAt(pos));
        advance();
      }
      advance(3);
      return new Token(TokenKind.STRING, sb.toString(), startLine, startCol);
    }

    advance();
    while (true) {
      if (pos >= input.length() || input.charAt(pos) == '\n') {
        throw new InvalidSyntaxException(file, startLine, startCol,
                                         "Unterminated string");
      }
      char c = input.charAt(pos);
      advance();
      if (c == '"') {
        break;
      } else if (c == '\\' && pos < input.length()) {
        sb.append(input.charAt(pos));
        advance();
      } else {
        sb.append(c);
      }
    }
    return new Token(TokenKind.STRING, sb.toString(), startLine, startCol);
  }

  private void skipWhitespaceAndComments() {
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (Character.isWhitespace(c)) {
        advance();
      } else if (input.startsWith("//", pos)) {
        while (pos < input.length() && input.charAt(pos) != '\n') {
          advance();
        }
      } else {
        break;
      }
    }
  }

  private void advance() {
    if (input.charAt(pos) == '\n') {
      line++;
      col = 0;
    } else {
      col++;
    }
    pos++;
  }

  private void advance(int n) {
    for (int i = 0; i < n; i++) {
      advance();
    }
  }

  private static boolean isIdentStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.';
  }
}

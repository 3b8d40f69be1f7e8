/*
 * Copyright 2025 The QSlice Authors
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
 * limitations under the License.
 */

package org.qslice.parser;

import com.google.errorprone.annotations.FormatMethod;
import java.io.IOException;
import java.nio.file.Path;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.qslice.ast.Program;

/** Parses OpenQASM source text into a {@link Program}. */
public final class QasmFrontEnd {

  // Static methods only
  private QasmFrontEnd() {}

  /** Parses the given file; the file's path is recorded as the program's source. */
  public static Program parse(Path file) throws IOException {
    return parse(CharStreams.fromPath(file), file.toString().replace('\\', '/'));
  }

  /** Parses program text. */
  public static Program parse(String text, String source) {
    return parse(CharStreams.fromString(text, source), source);
  }

  /**
   * Parses the given input.
   *
   * @param input the program text
   * @param source an identifier for the source of the program, e.g. a filename; it is carried
   *     through to the trace
   * @throws SyntaxError if the input does not match the grammar
   */
  public static Program parse(CharStream input, String source) {
    // Throw SyntaxErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new SyntaxError(msg, lineNum, charPositionInLine);
          }
        };
    QasmLexer lexer = new QasmLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    QasmParser parser = new QasmParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return new Program(source, new AstBuilder().visit(parser.program()));
  }

  /** Returns a new SyntaxError referring to the given token. */
  static SyntaxError error(Token token, String msg) {
    if (token == null) {
      // Shouldn't happen, but 0:0 is less useless than a NullPointerException.
      return new SyntaxError(msg, 0, 0);
    }
    return new SyntaxError(msg, token.getLine(), token.getCharPositionInLine());
  }

  /** Returns a new SyntaxError referring to the given token. */
  @FormatMethod
  static SyntaxError error(Token token, String fmt, Object... fmtArgs) {
    return error(token, String.format(fmt, fmtArgs));
  }
}

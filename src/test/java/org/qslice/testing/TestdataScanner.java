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

package org.qslice.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Provides the programs in a testdata directory as test parameters.
 *
 * <p>Each {@code .qasm} file may hold several programs; each program is followed by a comment
 * matching the scanner's pattern, whose first group holds the expected outcome. Code after the
 * last such comment becomes a program with a null comment.
 */
public abstract class TestdataScanner implements TestParameter.TestParameterValuesProvider {

  /** One program from a testdata file. */
  public record TestProgram(String name, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final Pattern commentPattern;

  protected TestdataScanner(Path dir, Pattern commentPattern) {
    this.dir = dir;
    this.commentPattern = commentPattern;
  }

  @Override
  public List<TestProgram> provideValues() {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : files.filter(f -> f.toString().endsWith(".qasm")).sorted().toList()) {
        result.addAll(split(file.getFileName().toString(), Files.readString(file)));
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result.build();
  }

  /** Splits the contents of one file into programs, named by file and starting line. */
  private List<TestProgram> split(String fileName, String text) {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    Matcher matcher = commentPattern.matcher(text);
    int start = 0;
    while (matcher.find()) {
      String code = text.substring(start, matcher.start()) + "\n";
      result.add(new TestProgram(name(fileName, text, start), code, matcher.group(1)));
      start = matcher.end();
    }
    String rest = text.substring(start);
    if (!rest.isBlank()) {
      result.add(new TestProgram(name(fileName, text, start), rest, null));
    }
    return result.build();
  }

  private static String name(String fileName, String text, int start) {
    int line = 1 + (int) text.substring(0, start).chars().filter(c -> c == '\n').count();
    return fileName + ":" + line;
  }
}

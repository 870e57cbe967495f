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
package spwn.ast;

import com.google.common.base.Objects;

/**
 * A line in a source file
 */
public class FilePosition {
  public final String file;
  public final int line;

  public FilePosition(String file, int line) {
    super();
    this.file = file;
    this.line = line;
  }

  public static FilePosition of(String file, SpwnAST tree) {
    return new FilePosition(file, tree.getLine());
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FilePosition)) {
      return false;
    }
    FilePosition other = (FilePosition)obj;
    return line == other.line && Objects.equal(file, other.file);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(file, line);
  }

  @Override
  public String toString() {
    return file + ":" + line;
  }
}

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
package spwn.common.exceptions;

import java.io.IOException;

/**
 * Exception for when a source file can't be read
 */
public class ModuleLoadException extends UserException {
  private static final long serialVersionUID = 1L;

  private final String filePath;

  public ModuleLoadException(String filePath, IOException cause) {
    super(buildMessage(filePath, cause), cause);
    this.filePath = filePath;
  }

  public String getFilePath() {
    return filePath;
  }

  private static String buildMessage(String filePath, IOException cause) {
    return "Error occurred while trying to load SPWN source file: "
        + filePath + ": " + cause.getMessage();
  }

}

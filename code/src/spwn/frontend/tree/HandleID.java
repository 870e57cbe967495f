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
package spwn.frontend.tree;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Handle literal: a group, color, item or block id.  An unspecified
 * handle (?g) has number 0 and is assigned a real id downstream.
 */
public class HandleID {
  public static final int MAX_NUMBER = 65535;

  private final int number;
  private final boolean unspecified;
  private final HandleClass handleClass;

  private HandleID(int number, boolean unspecified, HandleClass handleClass) {
    Preconditions.checkNotNull(handleClass);
    this.number = number;
    this.unspecified = unspecified;
    this.handleClass = handleClass;
  }

  public static HandleID explicit(int number, HandleClass handleClass) {
    Preconditions.checkArgument(number >= 0 && number <= MAX_NUMBER,
                                "handle number out of range: %s", number);
    return new HandleID(number, false, handleClass);
  }

  public static HandleID unspecified(HandleClass handleClass) {
    return new HandleID(0, true, handleClass);
  }

  public int getNumber() {
    return number;
  }

  public boolean isUnspecified() {
    return unspecified;
  }

  public HandleClass getHandleClass() {
    return handleClass;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof HandleID)) {
      return false;
    }
    HandleID other = (HandleID)obj;
    return number == other.number && unspecified == other.unspecified &&
           handleClass == other.handleClass;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(number, unspecified, handleClass);
  }

  @Override
  public String toString() {
    return (unspecified ? "?" : String.valueOf(number)) + handleClass.suffix();
  }
}

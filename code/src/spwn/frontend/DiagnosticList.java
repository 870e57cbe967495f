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
package spwn.frontend;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Level;

import com.google.common.collect.ImmutableList;

/**
 * Sink that keeps every diagnostic in order and logs each one
 * as a warning.
 */
public class DiagnosticList implements DiagnosticSink, Iterable<Diagnostic> {
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  @Override
  public void report(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
    LogHelper.log(0, Level.WARN, diagnostic.position.toString() + ": ",
                  diagnostic.message + " [" + diagnostic.ruleName + "]");
  }

  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }

  public int size() {
    return diagnostics.size();
  }

  public Diagnostic get(int i) {
    return diagnostics.get(i);
  }

  public List<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public List<Diagnostic> ofKind(Diagnostic.Kind kind) {
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Diagnostic d: diagnostics) {
      if (d.kind == kind) {
        result.add(d);
      }
    }
    return result;
  }

  @Override
  public Iterator<Diagnostic> iterator() {
    return getDiagnostics().iterator();
  }
}

/*
Copyright (c) 2024 CyberSheet

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.cybersheet.formula.impl.expr;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaValue;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Continues deeply nested lambda evaluation on fresh threads with a large
 * stack.  Every {@link #CALLS_PER_SEGMENT} nested calls the evaluation hops
 * to a new thread and the calling thread waits for it, so recursion is
 * bounded by the configured call depth instead of the stack size of the
 * thread which started the evaluation.
 */
final class StackSegments
{
  private static final Log LOG = LogFactory.getLog(StackSegments.class);

  /** nested lambda calls evaluated on one thread before hopping */
  static final int CALLS_PER_SEGMENT = 128;
  /** requested stack size of each segment thread */
  static final long SEGMENT_STACK_SIZE = 8L * 1024L * 1024L;

  private static final AtomicInteger SEGMENT_COUNT = new AtomicInteger();

  private StackSegments() {}

  /**
   * @return {@code true} if a call at the given lambda call depth should
   *         start a new segment
   */
  static boolean isSegmentStart(int callDepth) {
    return ((callDepth > 0) && ((callDepth % CALLS_PER_SEGMENT) == 0));
  }

  /**
   * Runs the given evaluation on a new segment thread and waits for it.
   * Anything thrown by the evaluation is rethrown on the calling thread.
   */
  static FormulaValue evalOnNewSegment(Supplier<FormulaValue> eval) {
    Segment segment = new Segment(eval);
    Thread thread = new Thread(
        null, segment, "formula-eval-" + SEGMENT_COUNT.incrementAndGet(),
        SEGMENT_STACK_SIZE);
    thread.setDaemon(true);
    if(LOG.isDebugEnabled()) {
      LOG.debug("Continuing nested evaluation on " + thread.getName());
    }
    thread.start();
    try {
      thread.join();
    } catch(InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EvalException(ErrorKind.VALUE,
                              "Interrupted during nested evaluation", e);
    }
    return segment.getResult();
  }

  private static final class Segment implements Runnable
  {
    private final Supplier<FormulaValue> _eval;
    private FormulaValue _result;
    private Throwable _failure;

    private Segment(Supplier<FormulaValue> eval) {
      _eval = eval;
    }

    @Override
    public void run() {
      try {
        _result = _eval.get();
      } catch(RuntimeException | Error e) {
        // handed back to the waiting thread
        _failure = e;
      }
    }

    public FormulaValue getResult() {
      if(_failure instanceof RuntimeException) {
        throw (RuntimeException)_failure;
      }
      if(_failure != null) {
        throw (Error)_failure;
      }
      return _result;
    }
  }
}

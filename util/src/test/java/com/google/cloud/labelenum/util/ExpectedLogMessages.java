/*
 * Copyright 2026 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.cloud.labelenum.util;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * JUnit rule that fails a test when a logger emits messages the test did not expect:
 *
 * <pre>
 * &#64;Rule
 * public final ExpectedLogMessages logged = ExpectedLogMessages.forLogger(LabelEnum.class);
 *
 * &#64;Test
 * public void logsDroppedDuplicate() {
 *   logged.setMinimumLevel(Level.FINE);
 *   LabelEnum.create("a", "a");
 *   logged.expect("Dropping duplicate label 'a'");
 * }
 * </pre>
 *
 * <p>Only records at {@code WARNING} or above are checked unless {@link #setMinimumLevel} lowers
 * the threshold. Expectations are verified after the test body completes.
 */
@CanIgnoreReturnValue
public final class ExpectedLogMessages implements TestRule {

  private final Logger logger;
  private final AssertingHandler handler = new AssertingHandler();
  private final List<String> expectedRegexes = new ArrayList<>();

  private Level originalLevel;

  private ExpectedLogMessages(Logger logger) {
    this.logger = logger;
  }

  /** Creates a rule for the logger named after {@code loggerClass}, as Flogger names it. */
  public static ExpectedLogMessages forLogger(Class<?> loggerClass) {
    return new ExpectedLogMessages(Logger.getLogger(loggerClass.getCanonicalName()));
  }

  /** Requires exactly one message matching {@code regex}, in the order of calls. */
  public ExpectedLogMessages expect(String regex) {
    expectedRegexes.add(checkNotNull(regex));
    return this;
  }

  /** Makes records at {@code level} and above visible to this rule. Default is {@code WARNING}. */
  public ExpectedLogMessages setMinimumLevel(Level level) {
    logger.setLevel(checkNotNull(level));
    handler.setLoggerLevel(logger.getName(), level);
    return this;
  }

  @Override
  public Statement apply(Statement base, Description description) {
    return new Statement() {
      @Override
      public void evaluate() throws Throwable {
        originalLevel = logger.getLevel();
        logger.addHandler(handler);
        try {
          base.evaluate();
          handler.assertContainsRegex(Iterables.toArray(expectedRegexes, String.class));
        } finally {
          logger.removeHandler(handler);
          logger.setLevel(originalLevel);
          handler.close();
        }
      }
    };
  }
}

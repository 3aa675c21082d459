/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Thrown at planning time when the worst-case buffered bytes of a plan
 * do not fit in the memory budget.
 */
public class BudgetExceededException extends ConversionException {

  private static final long serialVersionUID = 1L;

  /**
   * @param message description of the failure
   */
  public BudgetExceededException(String message) {
    super(message);
  }

}

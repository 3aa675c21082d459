/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Base class for every failure that aborts a conversion run.
 * A run that throws one of these leaves no usable output behind.
 */
public class ConversionException extends Exception {

  private static final long serialVersionUID = 1L;

  /**
   * @param message description of the failure
   */
  public ConversionException(String message) {
    super(message);
  }

  /**
   * @param message description of the failure
   * @param cause underlying exception
   */
  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }

}

/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Thrown when writing to the output container fails.
 */
public class TargetWriteException extends ConversionException {

  private static final long serialVersionUID = 1L;

  /**
   * @param message description of the failure
   */
  public TargetWriteException(String message) {
    super(message);
  }

  /**
   * @param message description of the failure
   * @param cause underlying exception
   */
  public TargetWriteException(String message, Throwable cause) {
    super(message, cause);
  }

}

/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Thrown when a run is cancelled between two tiles.
 */
public class ConversionCancelledException extends ConversionException {

  private static final long serialVersionUID = 1L;

  /**
   * @param message description of the failure
   */
  public ConversionCancelledException(String message) {
    super(message);
  }

}

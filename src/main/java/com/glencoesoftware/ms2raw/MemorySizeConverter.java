/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.Locale;

import picocli.CommandLine.ITypeConverter;

/**
 * Convert a string such as "512m" or "2G" to a number of bytes.
 * Accepted suffixes are k, m and g (powers of 1024); no suffix means bytes.
 */
public class MemorySizeConverter implements ITypeConverter<Long> {
  @Override
  public Long convert(String value) throws Exception {
    String v = value.trim().toLowerCase(Locale.ROOT);
    if (v.endsWith("b")) {
      v = v.substring(0, v.length() - 1);
    }
    long multiplier = 1;
    if (v.endsWith("k")) {
      multiplier = 1024L;
    }
    else if (v.endsWith("m")) {
      multiplier = 1024L * 1024;
    }
    else if (v.endsWith("g")) {
      multiplier = 1024L * 1024 * 1024;
    }
    if (multiplier > 1) {
      v = v.substring(0, v.length() - 1);
    }
    long size = Math.multiplyExact(Long.parseLong(v.trim()), multiplier);
    if (size <= 0) {
      throw new IllegalArgumentException("Invalid memory size: " + value);
    }
    return size;
  }
}

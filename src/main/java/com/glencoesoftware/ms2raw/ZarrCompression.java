/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.HashMap;
import java.util.Map;

import com.bc.zarr.Compressor;
import com.bc.zarr.CompressorFactory;

/**
 * Codecs available when writing Zarr arrays.
 */
public enum ZarrCompression {
  raw("null"),
  zlib("zlib"),
  blosc("blosc");

  private final String id;

  private ZarrCompression(final String id) {
    this.id = id;
  }

  /**
   * @param properties codec properties, e.g. "level"; may be null
   * @return a jzarr compressor configured with the given properties
   */
  public Compressor createCompressor(Map<String, Object> properties) {
    Map<String, Object> p = properties == null ?
      new HashMap<String, Object>() : properties;
    return CompressorFactory.create(id, p);
  }

  @Override
  public String toString() {
    return id;
  }
}

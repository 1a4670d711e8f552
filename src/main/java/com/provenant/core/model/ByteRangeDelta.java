package com.provenant.core.model;

import java.io.Serializable;

/**
 * A contiguous range of bytes that differs between two artifacts.
 *
 * @param offset first differing byte
 * @param length number of bytes in the range
 */
public record ByteRangeDelta(long offset, long length) implements Serializable {}

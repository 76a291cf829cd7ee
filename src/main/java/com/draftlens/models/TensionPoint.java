package com.draftlens.models;

/**
 * Sample of the tension curve. {@code position} is the fraction of the text read so far.
 */
public record TensionPoint(double position, double tensionLevel, int wordPosition) {
}

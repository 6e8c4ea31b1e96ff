package com.di.geoingest.warehouse;

/**
 * A row rejected by a streaming insert; {@code rowIndex} is the position inside the submitted chunk.
 */
public record InsertError(long rowIndex, String message) {
}

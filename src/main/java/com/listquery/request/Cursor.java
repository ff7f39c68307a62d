package com.listquery.request;

import java.util.UUID;

/**
 * Position of a row at the edge of a page.
 *
 * @param id     Row id
 * @param serial Row serial number
 */
public record Cursor(UUID id, long serial) {
}

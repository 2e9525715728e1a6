package org.econsim.runtime.model;

import java.util.Objects;

/**
 * A single collectible unit lying on the grid.
 *
 * @param position The cell holding the resource.
 * @param good The good it yields when collected.
 */
public record ResourceCell(Position position, Good good) {

    public ResourceCell {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(good, "good");
    }
}

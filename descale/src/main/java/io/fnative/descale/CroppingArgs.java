package io.fnative.descale;

import java.util.Optional;

/**
 * Descale geometry for one candidate source height. An absent axis is left at full resolution.
 */
public record CroppingArgs(Axis horizontal, Axis vertical) {
    public Optional<Axis> width() { return Optional.ofNullable(horizontal); }
    public Optional<Axis> height() { return Optional.ofNullable(vertical); }
}

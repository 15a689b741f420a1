package org.simprep.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dotted path identifying a controller within the controller tree.
 * <p>
 * The root controller is {@code 00}; the n-th sub-controller spawned under a controller
 * appends one two-digit segment, e.g. {@code 00.01}. Segments are limited to 0..99 so that
 * every id renders with fixed-width segments.
 *
 * @param segments path segments from the root, never empty
 */
public record ControllerId(List<Integer> segments) {

    public ControllerId {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Controller id needs at least one segment");
        }
        for (int segment : segments) {
            ArtifactNames.checkIndex("controller segment", segment);
        }
        segments = List.copyOf(segments);
    }

    /**
     * @return the id of the root controller, {@code 00}
     */
    public static ControllerId root() {
        return new ControllerId(List.of(0));
    }

    /**
     * Parses an id of the form {@code 00.01.03}.
     *
     * @param text the dotted id
     * @return the parsed id
     * @throws IllegalArgumentException if the text is not a dotted list of numbers
     */
    public static ControllerId parse(String text) {
        List<Integer> parsed = new ArrayList<>();
        for (String part : text.split("\\.", -1)) {
            try {
                parsed.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed controller id: " + text, e);
            }
        }
        return new ControllerId(parsed);
    }

    /**
     * Returns the id of a sub-controller of this controller.
     *
     * @param childIndex index of the child among this controller's sub-controllers
     * @return the child id
     */
    public ControllerId child(int childIndex) {
        List<Integer> extended = new ArrayList<>(segments);
        extended.add(childIndex);
        return new ControllerId(extended);
    }

    public int depth() {
        return segments.size();
    }

    @Override
    public String toString() {
        return segments.stream()
            .map(s -> String.format("%02d", s))
            .collect(Collectors.joining("."));
    }
}

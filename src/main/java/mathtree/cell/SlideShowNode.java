// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import mathtree.util.annotation.Nullable;

/**
 * An animation: a sequence of frames shown one at a time at a fixed frame rate.
 */
public final class SlideShowNode extends Node {
    /**
     * Initializes an animation. {@code frames} holds the resolved asset of each file name, {@code null} where it
     * couldn't be resolved.
     *
     * @throws IllegalArgumentException if the lists differ in length.
     */
    public SlideShowNode(final List<String> fileNames, final List<@Nullable Asset> frames) {
        if (fileNames.size() != frames.size()) {
            throw new IllegalArgumentException(
                "Got %d file names but %d frames".formatted(fileNames.size(), frames.size()));
        }
        this.fileNames = List.copyOf(fileNames);
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
        setKind(NodeKind.SLIDE);
    }

    public List<String> fileNames() {
        return fileNames;
    }

    public List<@Nullable Asset> frames() {
        return frames;
    }

    public int frameCount() {
        return frames.size();
    }

    public int frameRate() {
        return frameRate;
    }

    /**
     * Sets the frame rate in frames per second. Non-positive rates are ignored.
     */
    public void setFrameRate(final int frameRate) {
        if (frameRate > 0) {
            this.frameRate = frameRate;
        }
    }

    public int displayedFrame() {
        return displayedFrame;
    }

    /**
     * Selects the frame to show.
     *
     * @throws IndexOutOfBoundsException if there's no such frame.
     */
    public void setDisplayedFrame(final int index) {
        displayedFrame = Objects.checkIndex(index, frames.size());
        resetSize();
    }

    @Override
    String format() {
        return " << Animation >> ";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        int width = 0;
        int height = 0;
        for (final var frame : frames) {
            if (frame != null) {
                width = Math.max(width, frame.width());
                height = Math.max(height, frame.height());
            }
        }
        if (width == 0 || height == 0) {
            width = context.textWidth(format(), style(), fontSize);
            height = context.lineHeight(style(), fontSize);
        }
        height += 2 * ImageNode.FRAME;
        setSize(width + 2 * ImageNode.FRAME, height, height / 2);
    }

    static final int DEFAULT_FRAME_RATE = 2;

    private final List<String> fileNames;
    private final List<@Nullable Asset> frames;
    private int frameRate = DEFAULT_FRAME_RATE;
    private int displayedFrame = 0;
}

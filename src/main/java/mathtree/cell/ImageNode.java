// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import mathtree.util.annotation.Nullable;

/**
 * A plot or picture. The image data come from an asset resolver; an image that couldn't be resolved is laid
 * out as a placeholder.
 */
public final class ImageNode extends Node {
    /**
     * Initializes an image node.
     *
     * @param temporary whether the file was created only to be shown, and may be deleted once loaded.
     */
    public ImageNode(final String fileName, final @Nullable Asset asset, final boolean temporary) {
        this.fileName = fileName;
        this.asset = asset;
        this.temporary = temporary;
        setKind(NodeKind.IMAGE);
    }

    public String fileName() {
        return fileName;
    }

    public @Nullable Asset asset() {
        return asset;
    }

    public boolean isTemporary() {
        return temporary;
    }

    public boolean drawsRectangle() {
        return drawRectangle;
    }

    public void setDrawRectangle(final boolean drawRectangle) {
        this.drawRectangle = drawRectangle;
    }

    @Override
    String format() {
        return " << Graphics >> ";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        final var border = drawRectangle ? 2 * FRAME : 0;
        if (asset == null) {
            final var height = context.lineHeight(style(), fontSize) + border;
            setSize(context.textWidth(format(), style(), fontSize) + border, height, height / 2);
        } else {
            final var height = asset.height() + border;
            setSize(asset.width() + border, height, height / 2);
        }
    }

    static final int FRAME = 1;

    private final String fileName;
    private final @Nullable Asset asset;
    private final boolean temporary;
    private boolean drawRectangle = true;
}

package com.spreadsheet.grid.models;

import java.util.Objects;

/**
 * Presentation hints stored with a cell. Every field is optional (null means
 * "inherit"); the engine carries them through but never interprets them.
 */
public class CellStyle {
    private String numberFormat;
    private String fontFamily;
    private Float fontSize;
    private Boolean bold;
    private Boolean italic;
    // RGBA, e.g. "#1F2937FF"
    private String color;
    private String background;
    private HorizontalAlignment horizontalAlignment;
    private VerticalAlignment verticalAlignment;

    // Default constructor needed for JSON (de)serialization
    public CellStyle() {
    }

    public CellStyle(CellStyle other) {
        this.numberFormat = other.numberFormat;
        this.fontFamily = other.fontFamily;
        this.fontSize = other.fontSize;
        this.bold = other.bold;
        this.italic = other.italic;
        this.color = other.color;
        this.background = other.background;
        this.horizontalAlignment = other.horizontalAlignment;
        this.verticalAlignment = other.verticalAlignment;
    }

    /**
     * True when no field is set.
     */
    public boolean isDefault() {
        return numberFormat == null && fontFamily == null && fontSize == null
                && bold == null && italic == null && color == null && background == null
                && horizontalAlignment == null && verticalAlignment == null;
    }

    public String getNumberFormat() {
        return numberFormat;
    }
    public void setNumberFormat(String numberFormat) {
        this.numberFormat = numberFormat;
    }

    public String getFontFamily() {
        return fontFamily;
    }
    public void setFontFamily(String fontFamily) {
        this.fontFamily = fontFamily;
    }

    public Float getFontSize() {
        return fontSize;
    }
    public void setFontSize(Float fontSize) {
        this.fontSize = fontSize;
    }

    public Boolean getBold() {
        return bold;
    }
    public void setBold(Boolean bold) {
        this.bold = bold;
    }

    public Boolean getItalic() {
        return italic;
    }
    public void setItalic(Boolean italic) {
        this.italic = italic;
    }

    public String getColor() {
        return color;
    }
    public void setColor(String color) {
        this.color = color;
    }

    public String getBackground() {
        return background;
    }
    public void setBackground(String background) {
        this.background = background;
    }

    public HorizontalAlignment getHorizontalAlignment() {
        return horizontalAlignment;
    }
    public void setHorizontalAlignment(HorizontalAlignment horizontalAlignment) {
        this.horizontalAlignment = horizontalAlignment;
    }

    public VerticalAlignment getVerticalAlignment() {
        return verticalAlignment;
    }
    public void setVerticalAlignment(VerticalAlignment verticalAlignment) {
        this.verticalAlignment = verticalAlignment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellStyle)) {
            return false;
        }
        CellStyle other = (CellStyle) o;
        return Objects.equals(numberFormat, other.numberFormat)
                && Objects.equals(fontFamily, other.fontFamily)
                && Objects.equals(fontSize, other.fontSize)
                && Objects.equals(bold, other.bold)
                && Objects.equals(italic, other.italic)
                && Objects.equals(color, other.color)
                && Objects.equals(background, other.background)
                && horizontalAlignment == other.horizontalAlignment
                && verticalAlignment == other.verticalAlignment;
    }

    @Override
    public int hashCode() {
        return Objects.hash(numberFormat, fontFamily, fontSize, bold, italic, color, background,
                horizontalAlignment, verticalAlignment);
    }
}

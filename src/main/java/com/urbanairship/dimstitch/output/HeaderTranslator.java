package com.urbanairship.dimstitch.output;

import com.urbanairship.dimstitch.Dimension;
import com.urbanairship.dimstitch.DimensionSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns dimension ids into header cells. Only dimensions with a configured label are translated,
 * everything else keeps its id.
 */
public class HeaderTranslator {
    /**
     * How the header names a dimension that has a label:
     * <ul>
     * <li>LABEL: just the label, like "User ID"</li>
     * <li>LABEL_AND_ID: the label followed by the id, like "User ID (ga:dimension1)"</li>
     * <li>ID: no translation at all, like "ga:dimension1"</li>
     * </ul>
     */
    public enum Style {
        LABEL,
        LABEL_AND_ID,
        ID
    }

    private final DimensionSchema schema;
    private final Style style;

    public HeaderTranslator(DimensionSchema schema, Style style) {
        this.schema = schema;
        this.style = style;
    }

    public String translate(String dimensionId) {
        Dimension dimension = schema.getDimension(dimensionId);
        if (style == Style.ID || !dimension.hasTranslation()) {
            return dimension.getId();
        }
        if (style == Style.LABEL_AND_ID) {
            return dimension.getLabel() + " (" + dimension.getId() + ")";
        }
        return dimension.getLabel();
    }

    public List<String> translate(List<String> dimensionIds) {
        List<String> header = new ArrayList<>(dimensionIds.size());
        for (String dimensionId : dimensionIds) {
            header.add(translate(dimensionId));
        }
        return header;
    }
}

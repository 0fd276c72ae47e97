package com.gateway.service.reformat;

/**
 * Description helpers shared by the reformatters.
 */
final class Descriptions {

    private Descriptions() {
    }

    /**
     * @return The first paragraph of a description, or {@code null} for {@code null}.
     */
    static String firstParagraph(String description) {
        if (description == null) {
            return null;
        }
        return description.trim().split("\n\n", 2)[0];
    }
}

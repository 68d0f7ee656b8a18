package io.github.jbellis.lazyjira.ui;

import java.util.ArrayList;
import java.util.List;
import org.jline.utils.AttributedString;

/** Column-aware helpers for fitting text into fixed-width terminal rows. */
final class TextLayout {
    private TextLayout() {}

    /** Cuts {@code line} to {@code width} columns, marking the cut with an ellipsis. */
    static AttributedString fit(AttributedString line, int width) {
        if (width <= 0) {
            return AttributedString.EMPTY;
        }
        if (line.columnLength() <= width) {
            return line;
        }
        if (width == 1) {
            return line.columnSubSequence(0, 1);
        }
        return AttributedString.join(
                AttributedString.EMPTY, line.columnSubSequence(0, width - 1), new AttributedString("…"));
    }

    static String pad(String text, int width) {
        if (text.length() >= width) {
            return text.substring(0, width);
        }
        return text + " ".repeat(width - text.length());
    }

    /** Word-wraps {@code text} at whitespace; words longer than a row are split. Keeps explicit newlines. */
    static List<String> wrap(String text, int width) {
        var lines = new ArrayList<String>();
        if (width <= 0) {
            return lines;
        }
        for (var paragraph : text.split("\\R", -1)) {
            var current = new StringBuilder();
            for (var word : paragraph.split(" ")) {
                while (word.length() > width) {
                    if (current.length() > 0) {
                        lines.add(current.toString());
                        current.setLength(0);
                    }
                    lines.add(word.substring(0, width));
                    word = word.substring(width);
                }
                if (current.length() == 0) {
                    current.append(word);
                } else if (current.length() + 1 + word.length() <= width) {
                    current.append(' ').append(word);
                } else {
                    lines.add(current.toString());
                    current.setLength(0);
                    current.append(word);
                }
            }
            lines.add(current.toString());
        }
        return lines;
    }
}

package com.fourinarow.chat;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.safety.Safelist;

/**
 * Strips every tag from user text. Script and style bodies are dropped with
 * their tags; remaining text is entity-escaped.
 */
public class MarkupSanitizer {

    /**
     * @return the plain, trimmed text; empty if nothing printable remains
     */
    public String sanitize(String text) {
        if (text == null) {
            return "";
        }
        Document.OutputSettings output = new Document.OutputSettings().prettyPrint(false);
        return Jsoup.clean(text, "", Safelist.none(), output).trim();
    }
}

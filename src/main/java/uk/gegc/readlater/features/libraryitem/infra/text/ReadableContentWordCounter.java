package uk.gegc.readlater.features.libraryitem.infra.text;

import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/**
 * Counts the words of readable HTML content.
 */
@Component
public class ReadableContentWordCounter {

    public int countWords(String html) {
        if (html == null || html.isBlank()) {
            return 0;
        }
        String text = Jsoup.parse(html).text().trim();
        if (text.isEmpty()) {
            return 0;
        }
        return text.split("[\\s\\u00A0]+").length;
    }
}

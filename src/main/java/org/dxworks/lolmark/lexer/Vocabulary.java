package org.dxworks.lolmark.lexer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

public final class Vocabulary {

    public static final char TAG_PREFIX = '#';

    public static final String HAI = "#hai";
    public static final String KTHXBYE = "#kthxbye";
    public static final String OBTW = "#obtw";
    public static final String TLDR = "#tldr";
    public static final String MAEK = "#maek";
    public static final String OIC = "#oic";
    public static final String GIMMEH = "#gimmeh";
    public static final String MKAY = "#mkay";
    public static final String I = "#i";
    public static final String IT = "#it";
    public static final String LEMME = "#lemme";

    // second words of the two-word variable markers
    public static final String HAZ = "haz";
    public static final String IZ = "iz";
    public static final String SEE = "see";

    public static final String HEAD = "head";
    public static final String TITLE = "title";
    public static final String PARAGRAF = "paragraf";
    public static final String BOLD = "bold";
    public static final String ITALICS = "italics";
    public static final String LIST = "list";
    public static final String ITEM = "item";
    public static final String NEWLINE = "newline";
    public static final String SOUNDZ = "soundz";
    public static final String VIDZ = "vidz";

    public static final Pattern FREE_TEXT = Pattern.compile("^[A-Za-z0-9,.'\":?!_/ ]+$");
    public static final Pattern ADDRESS = Pattern.compile("^[A-Za-z0-9,.'\":?!_/%]+$");
    public static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z]+$");

    public static final Map<String, TokenCategory> TAG_KEYWORDS;
    public static final Map<String, TokenCategory> ELEMENT_KEYWORDS;

    static {
        Map<String, TokenCategory> tags = new LinkedHashMap<>();
        tags.put(HAI, TokenCategory.DOCUMENT_START);
        tags.put(KTHXBYE, TokenCategory.DOCUMENT_END);
        tags.put(OBTW, TokenCategory.COMMENT_START);
        tags.put(TLDR, TokenCategory.COMMENT_END);
        tags.put(MAEK, TokenCategory.BLOCK_START);
        tags.put(OIC, TokenCategory.BLOCK_END);
        tags.put(GIMMEH, TokenCategory.ELEMENT_START);
        tags.put(MKAY, TokenCategory.ELEMENT_END);
        tags.put(I, TokenCategory.VARIABLE_DECLARE_START);
        tags.put(IT, TokenCategory.VARIABLE_DECLARE_MID);
        tags.put(LEMME, TokenCategory.VARIABLE_USE_START);
        TAG_KEYWORDS = Collections.unmodifiableMap(tags);

        Map<String, TokenCategory> elements = new LinkedHashMap<>();
        elements.put(HEAD, TokenCategory.HEAD);
        elements.put(TITLE, TokenCategory.TITLE);
        elements.put(PARAGRAF, TokenCategory.PARAGRAPH);
        elements.put(BOLD, TokenCategory.BOLD);
        elements.put(ITALICS, TokenCategory.ITALICS);
        elements.put(LIST, TokenCategory.LIST);
        elements.put(ITEM, TokenCategory.ITEM);
        elements.put(NEWLINE, TokenCategory.NEWLINE);
        elements.put(SOUNDZ, TokenCategory.SOUNDZ);
        elements.put(VIDZ, TokenCategory.VIDZ);
        ELEMENT_KEYWORDS = Collections.unmodifiableMap(elements);
    }

    private Vocabulary() {
    }
}

/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.util;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import edu.mit.jwi.item.POS;

import ca.mcgill.cs.mwn.DecodingException;
import ca.mcgill.cs.mwn.Language;


/**
 * Decodes MultiWordNet synset identifiers.  An identifier has the form {@code
 * pos#offset}, e.g., {@code n#00001740}.  English offsets are all digits; for
 * synsets first defined in another language, the first character of the
 * offset is a marker for that language, e.g., {@code n#N0001740} for Italian.
 */
public final class SynsetIds {

    /**
     * The separator between the part of speech and the offset.
     */
    public static final char SEPARATOR = '#';

    private static final Map<Character,Language> MARKERS;
    static {
        Map<Character,Language> m = new HashMap<Character,Language>();
        m.put('N', Language.ITALIAN);
        m.put('W', Language.ITALIAN);
        m.put('Y', Language.ITALIAN);
        m.put('H', Language.HEBREW);
        m.put('S', Language.SPANISH);
        m.put('L', Language.LATIN);
        m.put('R', Language.ROMANIAN);
        // Portuguese synsets are kept in the reference store
        m.put('P', Language.REFERENCE);
        MARKERS = Collections.unmodifiableMap(m);
    }

    private SynsetIds() { }

    /**
     * Returns the language in whose store the synset has its authoritative
     * record.
     *
     * @throws DecodingException if the id is malformed or its language marker
     *         is unknown
     */
    public static Language getOriginLanguage(String id) {
        checkLayout(id);
        char marker = id.charAt(2);
        if (Character.isDigit(marker))
            return Language.REFERENCE;
        Language lang = MARKERS.get(marker);
        if (lang == null)
            throw new DecodingException(id, "unknown language marker '"
                                        + marker + "'");
        return lang;
    }

    /**
     * Returns the part of speech encoded at the start of the id.
     *
     * @throws DecodingException if the id is malformed
     */
    public static POS getPOS(String id) {
        checkLayout(id);
        return toPOS(id.charAt(0));
    }

    /**
     * Returns the offset, i.e., everything after the separator.
     *
     * @throws DecodingException if the id is malformed
     */
    public static String getOffset(String id) {
        checkLayout(id);
        return id.substring(2);
    }

    /**
     * Returns {@code true} if the id can be decoded.
     */
    public static boolean isValid(String id) {
        try {
            getOriginLanguage(id);
            return true;
        } catch (DecodingException de) {
            return false;
        }
    }

    /**
     * Returns the WordNet part of speech for the one-letter tag, or {@code
     * null} for tags outside {@code n v a r}.
     */
    public static POS toPOS(char tag) {
        for (POS pos : POS.values()) {
            if (pos.getTag() == tag)
                return pos;
        }
        return null;
    }

    private static void checkLayout(String id) {
        if (id == null || id.length() < 3)
            throw new DecodingException(String.valueOf(id), "too short");
        if (id.charAt(1) != SEPARATOR)
            throw new DecodingException(id, "missing '" + SEPARATOR + "'");
        if (toPOS(id.charAt(0)) == null)
            throw new DecodingException(id, "unknown part of speech '"
                                        + id.charAt(0) + "'");
    }
}

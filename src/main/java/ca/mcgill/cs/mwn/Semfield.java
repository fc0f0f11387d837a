/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.util.List;

import com.google.common.base.Optional;


/**
 * The interface for a semantic field, a node of the subject-area hierarchy
 * shared by all languages, e.g., {@code Zoology} under {@code Biology}.  A
 * field is identified by its English name together with its code.
 */
public interface Semfield {

    /**
     * Returns the English name, with words joined by {@code _}.
     */
    String getEnglish();

    String getCode();

    /**
     * Returns the language through which the field's synsets are fetched.
     */
    Language getLanguage();

    List<Synset> getSynsets();

    /**
     * Returns the fields immediately above this one.
     */
    List<Semfield> getHypers();

    /**
     * Returns the fields immediately below this one.
     */
    List<Semfield> getHypons();

    /**
     * Returns the basic-level field to which this one belongs.
     */
    Optional<Semfield> getNormal();
}

/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import edu.mit.jwi.item.POS;


/**
 * Thrown when a relation type is requested for a part of speech that does not
 * define it, e.g., {@code part-of} for a verb.  This signals a programming
 * error in the caller, which is distinct from a synset simply having no
 * relations of a valid type.
 */
public class UnsupportedRelationException extends WordNetException {

    private static final long serialVersionUID = 1L;

    private final Relation.RelationType type;

    private final POS pos;

    public UnsupportedRelationException(Relation.RelationType type, POS pos) {
        super("No relation type '" + type.getSymbol() + "' (" + type
              + ") for '" + pos + "'");
        this.type = type;
        this.pos = pos;
    }

    public Relation.RelationType getType() {
        return type;
    }

    public POS getPos() {
        return pos;
    }
}

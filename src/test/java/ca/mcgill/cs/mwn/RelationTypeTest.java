/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.util.HashSet;
import java.util.Set;

import edu.mit.jwi.item.POS;

import ca.mcgill.cs.mwn.Relation.RelationType;

import org.junit.Test;

import static org.junit.Assert.*;


public class RelationTypeTest {

    @Test public void testSymbolsAreUnique() {
        Set<String> symbols = new HashSet<String>();
        for (RelationType t : RelationType.values())
            assertTrue(t.getSymbol(), symbols.add(t.getSymbol()));
    }

    @Test public void testFromSymbol() {
        assertEquals(RelationType.HYPERNYM, RelationType.fromSymbol("@").get());
        assertEquals(RelationType.DERIVED_FROM,
                     RelationType.fromSymbol("\\").get());
        assertEquals(RelationType.COMPOSED_OF,
                     RelationType.fromSymbol("+c").get());
        assertEquals(RelationType.COMPOSES, RelationType.fromSymbol("-c").get());
        assertFalse(RelationType.fromSymbol("?").isPresent());
    }

    @Test public void testNamesDependOnPartOfSpeech() {
        assertEquals("attribute", RelationType.ATTRIBUTE.getName(POS.NOUN));
        assertEquals("is-value-of",
                     RelationType.ATTRIBUTE.getName(POS.ADJECTIVE));
        assertEquals("pertains-to (lexical)",
                     RelationType.DERIVED_FROM.getName(POS.ADJECTIVE));
        assertEquals("derived-from (lexical)",
                     RelationType.DERIVED_FROM.getName(POS.NOUN));
        assertEquals("antonym (lexical)",
                     RelationType.ANTONYM.getName(POS.ADVERB));
    }

    @Test public void testDefinedFor() {
        assertTrue(RelationType.PART_OF.isDefinedFor(POS.NOUN));
        assertFalse(RelationType.PART_OF.isDefinedFor(POS.VERB));
        assertTrue(RelationType.ENTAILMENT.isDefinedFor(POS.VERB));
        assertFalse(RelationType.ENTAILMENT.isDefinedFor(POS.NOUN));
        assertTrue(RelationType.SIMILAR_TO.isDefinedFor(POS.ADJECTIVE));
        assertFalse(RelationType.HYPERNYM.isDefinedFor(null));
    }

    @Test public void testUndefinedName() {
        try {
            RelationType.ENTAILMENT.getName(POS.NOUN);
            fail("entailment is not defined for nouns");
        } catch (UnsupportedRelationException ure) {
            assertEquals(RelationType.ENTAILMENT, ure.getType());
            assertEquals(POS.NOUN, ure.getPos());
        }
    }

    @Test public void testLexicalTypes() {
        assertTrue(RelationType.ANTONYM.isLexical());
        assertTrue(RelationType.PARTICIPLE.isLexical());
        assertFalse(RelationType.HYPERNYM.isLexical());
    }
}

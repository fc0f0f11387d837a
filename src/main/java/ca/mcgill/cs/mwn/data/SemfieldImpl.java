/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import ca.mcgill.cs.mwn.Language;
import ca.mcgill.cs.mwn.Semfield;
import ca.mcgill.cs.mwn.Synset;

import ca.mcgill.cs.mwn.store.Query;
import ca.mcgill.cs.mwn.store.Row;
import ca.mcgill.cs.mwn.store.Tables;


/**
 * A {@link Semfield} read from the shared hierarchy table.  Its synsets and
 * neighboring fields are looked up on first access and kept thereafter.
 */
public class SemfieldImpl implements Semfield {

    private final String english;

    private final String code;

    private final Language language;

    private final EntityResolver resolver;

    private final Supplier<Optional<Row>> hierarchyRow;

    private final Supplier<List<Synset>> synsets;

    private final Supplier<List<Semfield>> hypers;

    private final Supplier<List<Semfield>> hypons;

    private final Supplier<Optional<Semfield>> normal;

    public SemfieldImpl(String english, String code, Language language,
                        EntityResolver resolver) {
        this.english = english;
        this.code = code;
        this.language = language;
        this.resolver = resolver;
        this.hierarchyRow = Suppliers.memoize(new Supplier<Optional<Row>>() {
                public Optional<Row> get() {
                    return SemfieldImpl.this.resolver.findHierarchyRow(
                        SemfieldImpl.this.english, SemfieldImpl.this.code);
                }
            });
        this.synsets = Suppliers.memoize(new Supplier<List<Synset>>() {
                public List<Synset> get() {
                    return Collections.unmodifiableList(readSynsets());
                }
            });
        this.hypers = Suppliers.memoize(new Supplier<List<Semfield>>() {
                public List<Semfield> get() {
                    return Collections.unmodifiableList(readRelated("hypers"));
                }
            });
        this.hypons = Suppliers.memoize(new Supplier<List<Semfield>>() {
                public List<Semfield> get() {
                    return Collections.unmodifiableList(readRelated("hypons"));
                }
            });
        this.normal = Suppliers.memoize(new Supplier<Optional<Semfield>>() {
                public Optional<Semfield> get() {
                    List<Semfield> n = readRelated("normal");
                    return (n.isEmpty())
                        ? Optional.<Semfield>absent() : Optional.of(n.get(0));
                }
            });
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getEnglish() {
        return english;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getCode() {
        return code;
    }

    /**
     * {@inheritDoc}
     */
    @Override public Language getLanguage() {
        return language;
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Synset> getSynsets() {
        return synsets.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Semfield> getHypers() {
        return hypers.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Semfield> getHypons() {
        return hypons.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Semfield> getNormal() {
        return normal.get();
    }

    /**
     * Returns the synsets whose field lists, in the shared table and then in
     * the language's own, name this field.
     */
    private List<Synset> readSynsets() {
        Query q = Query.where("english", english, Query.Match.CONTAINS);
        List<Row> rows = new ArrayList<Row>(
            resolver.select(Language.COMMON, Tables.SEMFIELD, q));
        if (language != Language.COMMON)
            rows.addAll(resolver.select(language, Tables.SEMFIELD, q));

        Set<Synset> found = new LinkedHashSet<Synset>();
        for (Row r : rows) {
            if (!r.getTokens("english").contains(english))
                continue;
            Optional<Synset> s = resolver.getSynset(r.get("synset"), language);
            if (s.isPresent())
                found.add(s.get());
        }
        return new ArrayList<Synset>(found);
    }

    private List<Semfield> readRelated(String column) {
        List<Semfield> related = new ArrayList<Semfield>();
        Optional<Row> row = hierarchyRow.get();
        if (!row.isPresent())
            return related;
        for (String name : row.get().getTokens(column)) {
            Optional<Semfield> f =
                resolver.resolveRelatedSemfield(name, code, language);
            if (f.isPresent())
                related.add(f.get());
        }
        return related;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof Semfield))
            return false;
        Semfield s = (Semfield)o;
        return s.getEnglish().equals(english) && s.getCode().equals(code);
    }

    @Override public int hashCode() {
        return english.hashCode() * 31 + code.hashCode();
    }

    public String toString() {
        return english.replace('_', ' ');
    }
}

/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.io.File;

import java.util.logging.Level;

import com.google.common.base.Optional;

import org.json.JSONArray;
import org.json.JSONObject;

import edu.mit.jwi.item.POS;

import edu.ucla.sspace.common.ArgOptions;

import ca.mcgill.cs.mwn.store.SqliteWordNetStore;

import ca.mcgill.cs.mwn.util.JsonUtils;
import ca.mcgill.cs.mwn.util.MwnLogger;
import ca.mcgill.cs.mwn.util.SynsetIds;


/**
 * A command-line browser that looks up a lemma or a synset in the WordNet of
 * one language and prints what it finds as JSON.
 */
public class MwnBrowser {

    /**
     * The depth to which a closure is followed unless another is given.
     */
    public static final int DEFAULT_CLOSURE_DEPTH = -1;

    private final WordNet wordNet;

    public MwnBrowser(WordNet wordNet) {
        this.wordNet = wordNet;
    }

    /**
     * Describes the lemma with each of its synsets, or returns absent if the
     * WordNet has no such lemma.
     *
     * @param pos the part of speech, or {@code null} for any
     *
     * @throws DisambiguationException if {@code pos} is {@code null} and the
     *         lemma has several parts of speech
     */
    public Optional<JSONObject> describeLemma(String lemma, POS pos) {
        Optional<Lemma> l = wordNet.getLemma(lemma, pos);
        if (!l.isPresent())
            return Optional.absent();

        JSONObject json = JsonUtils.toJson(l.get());
        JSONArray synsets = new JSONArray();
        for (Synset s : l.get().getSynsets())
            synsets.put(JsonUtils.toJson(s));
        json.put("synsets", synsets);
        json.put("synonyms", JsonUtils.toArray(l.get().getSynonyms()));
        json.put("antonyms", JsonUtils.toArray(l.get().getAntonyms()));
        json.put("derivates", JsonUtils.toArray(l.get().getDerivates()));
        Optional<Morpho> morpho = l.get().getMorpho();
        if (morpho.isPresent())
            json.put("morpho", JsonUtils.toJson(morpho.get()));
        return Optional.of(json);
    }

    /**
     * Describes the synset with its place in the hypernym taxonomy and, if
     * {@code closureType} is not {@code null}, its closure under that type.
     *
     * @throws DecodingException if the id is malformed
     * @throws UnsupportedRelationException if the synset's part of speech does
     *         not define {@code closureType}
     */
    public Optional<JSONObject> describeSynset(String id,
                                               Relation.RelationType closureType,
                                               int closureDepth) {
        Optional<Synset> s = wordNet.getSynset(id);
        if (!s.isPresent())
            return Optional.absent();

        Synset synset = s.get();
        JSONObject json = JsonUtils.toJson(synset);
        JSONArray semfields = new JSONArray();
        for (Semfield f : synset.getSemfields())
            semfields.put(JsonUtils.toJson(f));
        json.put("semfields", semfields);
        JSONArray relations = new JSONArray();
        for (Relation r : synset.getRelations())
            relations.put(JsonUtils.toJson(r));
        json.put("relations", relations);
        json.put("max_depth", synset.getMaxDepth());
        json.put("min_depth", synset.getMinDepth());
        json.put("roots", JsonUtils.idsToJson(synset.getRoots()));
        json.put("paths_to_root",
                 JsonUtils.pathsToJson(synset.getPathsToRoot()));
        if (closureType != null) {
            json.put("closure", JsonUtils.idsToJson(
                synset.getClosure(closureType, closureDepth)));
        }
        return Optional.of(json);
    }

    public static void main(String[] args) {
        try {
            ArgOptions opts = createOptions();
            opts.parseOptions(args);

            if (opts.hasOption('v'))
                MwnLogger.setLevel(Level.FINE);
            if (opts.hasOption('V'))
                MwnLogger.setLevel(Level.FINER);

            if (opts.hasOption('w') == opts.hasOption('s')) {
                usage(opts);
                System.exit(1);
            }

            Language language = (opts.hasOption('l'))
                ? Language.fromCode(opts.getStringOption('l'))
                : Language.REFERENCE;
            POS pos = null;
            if (opts.hasOption('p')) {
                String tag = opts.getStringOption('p');
                pos = (tag.length() == 1) ? SynsetIds.toPOS(tag.charAt(0)) : null;
                if (pos == null) {
                    System.out.println("Unknown part of speech: " + tag);
                    System.exit(1);
                }
            }
            Relation.RelationType closureType = null;
            if (opts.hasOption('c')) {
                String symbol = opts.getStringOption('c');
                Optional<Relation.RelationType> t =
                    Relation.RelationType.fromSymbol(symbol);
                if (!t.isPresent()) {
                    System.out.println("Unknown relation type: " + symbol);
                    System.exit(1);
                }
                closureType = t.get();
            }
            int depth = (opts.hasOption('D'))
                ? opts.getIntOption('D') : DEFAULT_CLOSURE_DEPTH;

            try (SqliteWordNetStore store = (opts.hasOption('d'))
                     ? new SqliteWordNetStore(new File(opts.getStringOption('d')))
                     : SqliteWordNetStore.openDefault()) {
                MwnBrowser browser =
                    new MwnBrowser(new WordNet(language, store));
                Optional<JSONObject> found = (opts.hasOption('w'))
                    ? browser.describeLemma(opts.getStringOption('w'), pos)
                    : browser.describeSynset(opts.getStringOption('s'),
                                             closureType, depth);
                if (!found.isPresent()) {
                    System.out.println("Not found in " + language.getCode());
                    System.exit(1);
                }
                System.out.println(found.get().toString(2));
            }
        }
        catch (DisambiguationException de) {
            System.out.println(de.getMessage() + "; specify one with -p");
            System.exit(1);
        }
        catch (Throwable t) {
            t.printStackTrace();
            System.exit(1);
        }
    }

    private static ArgOptions createOptions() {
        ArgOptions options = new ArgOptions();

        options.addOption('w', "lemma",
                          "the lemma to look up",
                          true, "LEMMA", "Lookup Options");
        options.addOption('s', "synset",
                          "the id of the synset to look up, e.g., n#00001740",
                          true, "ID", "Lookup Options");
        options.addOption('p', "pos",
                          "the part of speech of the lemma (n, v, a or r)",
                          true, "POS", "Lookup Options");
        options.addOption('l', "language",
                          "the language of the WordNet (default: english)",
                          true, "LANG", "Lookup Options");

        options.addOption('c', "closure",
                          "the symbol of a relation type whose closure " +
                          "from the synset should be listed, e.g., @",
                          true, "TYPE", "Synset Options");
        options.addOption('D', "closure-depth",
                          "the maximum depth of the closure (default: " +
                          "unlimited)",
                          true, "INT", "Synset Options");

        options.addOption('d', "db-dir",
                          "the directory of the MultiWordNet databases " +
                          "(default: the " + SqliteWordNetStore.DB_DIR_PROPERTY +
                          " system property)",
                          true, "DIR", "Program Options");
        options.addOption('v', "verbose", "prints verbose output",
                          false, null, "Program Options");
        options.addOption('V', "veryVerbose", "prints very verbose output, "+
                          "which is generally only useful for debugging",
                          false, null, "Program Options");

        return options;
    }

    /**
     * Prints out information on how to run the program to {@code stdout}.
     */
    private static void usage(ArgOptions argOptions) {
        System.out.println(
            "usage: java "
            + MwnBrowser.class.getName()
            + " [options] (-w LEMMA | -s ID)\n"
            + argOptions.prettyPrint());
    }
}

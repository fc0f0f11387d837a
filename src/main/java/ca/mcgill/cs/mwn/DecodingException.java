/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;


/**
 * Thrown when a synset identifier, relation symbol or morphological tag
 * string does not follow its fixed layout.
 */
public class DecodingException extends WordNetException {

    private static final long serialVersionUID = 1L;

    private final String input;

    public DecodingException(String input, String reason) {
        super("cannot decode \"" + input + "\": " + reason);
        this.input = input;
    }

    /**
     * Returns the string that could not be decoded.
     */
    public String getInput() {
        return input;
    }
}

/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;


/**
 * The base class for all failures raised while interpreting or traversing the
 * MultiWordNet.  A missing table, row or entity is never reported through an
 * exception; those cases yield an absent or empty result instead.
 */
public class WordNetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public WordNetException(String message) {
        super(message);
    }

    public WordNetException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ufilename.core.env;

import com.ufilename.core.policy.NamingException;

/** Named message-digest functions. */
public interface HashProvider {

    boolean supports(String algorithm);

    /**
     * @throws NamingException with kind UNKNOWN_ALGORITHM for an unsupported name
     */
    byte[] digest(String algorithm, byte[] data);
}

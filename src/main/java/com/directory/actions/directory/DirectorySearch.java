package com.directory.actions.directory;

import com.directory.actions.core.model.Identity;

import java.util.List;

/**
 * Raw directory lookup. Returns accounts whose display name, CN or handle loosely contains
 * the query, in the backend's own order and without ranking.
 */
public interface DirectorySearch {

    /**
     * @param queryText free-text query, already validated by the caller
     * @return matching identities, possibly empty
     * @throws DirectoryException if the backend call fails
     */
    List<Identity> search(String queryText) throws DirectoryException;
}

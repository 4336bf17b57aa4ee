package com.staybot.fetch;

import com.staybot.model.Candidate;
import com.staybot.model.SearchCriteria;

import java.util.List;

/**
 * A listing source.
 */
public interface Fetcher {

    /**
     * Short lower-case tag stored as the candidates' source.
     */
    String name();

    List<Candidate> fetch(SearchCriteria criteria) throws FetchException;
}

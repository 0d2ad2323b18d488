package com.conveyal.trackingauth.upstream;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One page of search results from the tracking server, with the token to request the page after it.
 * The token is null on the last page.
 */
public class PagedList<T> {

    public final List<T> items;

    public final String nextPageToken;

    public PagedList (List<T> items, String nextPageToken) {
        this.items = ImmutableList.copyOf(items);
        this.nextPageToken = (nextPageToken == null || nextPageToken.isEmpty()) ? null : nextPageToken;
    }

    public int size () {
        return items.size();
    }

    public boolean isEmpty () {
        return items.isEmpty();
    }

    public boolean isLastPage () {
        return nextPageToken == null;
    }

}

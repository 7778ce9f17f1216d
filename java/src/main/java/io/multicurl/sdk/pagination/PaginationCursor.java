package io.multicurl.sdk.pagination;

import java.util.Locale;

/**
 * Page-count knowledge about one paginated resource.
 *
 * <p>
 * Starts {@link Mode#UNKNOWN} with one page. Evidence moves it to {@link Mode#ESTIMATED} (a speculative total that
 * only ever grows), to {@link Mode#KNOWN} (an authoritative total, fixed from then on) or to {@link Mode#BOOKMARK}
 * (cursor pagination: the total is meaningless and only the next cursor URL matters). {@code KNOWN} and
 * {@code BOOKMARK} are terminal.
 * </p>
 *
 * <p>
 * Not thread-safe: a cursor belongs to the single operation fetching its resource.
 * </p>
 */
public final class PaginationCursor {

    public enum Mode {
        UNKNOWN,
        ESTIMATED,
        KNOWN,
        BOOKMARK
    }

    private Mode mode = Mode.UNKNOWN;
    private int totalPages = 1;
    private String nextUrl;

    /**
     * Raises the speculative total. Ignored once the total is known or the resource is cursor-paginated; never lowers
     * the estimate.
     */
    public void estimate(int pages) {
        if (mode == Mode.KNOWN || mode == Mode.BOOKMARK) {
            return;
        }
        if (pages > totalPages) {
            totalPages = pages;
        }
        mode = Mode.ESTIMATED;
    }

    /**
     * Records the authoritative total. This is the only way the total can go down. Ignored once known or in bookmark
     * mode.
     */
    public void fix(int pages) {
        if (mode == Mode.KNOWN || mode == Mode.BOOKMARK) {
            return;
        }
        totalPages = Math.max(1, pages);
        mode = Mode.KNOWN;
    }

    /**
     * Switches to cursor pagination for good.
     */
    public void enterBookmark(String url) {
        mode = Mode.BOOKMARK;
        nextUrl = url;
    }

    /**
     * Moves to the next cursor; {@code null} means the last page has been fetched.
     */
    public void advance(String url) {
        if (mode != Mode.BOOKMARK) {
            throw new IllegalStateException("cursor is not in bookmark mode");
        }
        nextUrl = url;
    }

    public Mode mode() {
        return mode;
    }

    public int totalPages() {
        return totalPages;
    }

    public boolean lastPageKnown() {
        return mode == Mode.KNOWN;
    }

    public boolean isBookmark() {
        return mode == Mode.BOOKMARK;
    }

    public String nextUrl() {
        return nextUrl;
    }

    public boolean isSinglePage() {
        return mode != Mode.BOOKMARK && totalPages == 1 && mode != Mode.ESTIMATED;
    }

    @Override
    public String toString() {
        return mode == Mode.BOOKMARK ? "bookmark(" + nextUrl + ")" : mode.name().toLowerCase(Locale.ROOT) + "(" + totalPages + ")";
    }
}

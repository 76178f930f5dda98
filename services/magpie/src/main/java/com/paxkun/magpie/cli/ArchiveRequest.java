package com.paxkun.magpie.cli;

import com.paxkun.magpie.service.source.SourceAdapter;
import com.paxkun.magpie.service.source.SourceRegistry;
import org.springframework.boot.ApplicationArguments;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Validated command line of one invocation.
 *
 * @param source    the one selected source adapter
 * @param bookId    book identifier on that source
 * @param overwrite redo discovery and assembly for every chapter
 * @param showIndex open the generated listing when done
 * @param rescan    revisit archived books; reserved
 */
public record ArchiveRequest(SourceAdapter source, String bookId, boolean overwrite, boolean showIndex, boolean rescan) {

    static final String BOOK_ID = "book-id";
    static final String OVERWRITE = "overwrite";
    static final String SHOW_INDEX = "show-index";
    static final String RESCAN = "rescan";

    /**
     * @throws IllegalArgumentException when the arguments do not select exactly one source and one book
     */
    public static ArchiveRequest parse(ApplicationArguments args, SourceRegistry registry) {
        List<SourceAdapter> selected = new ArrayList<>();
        for (String flag : registry.flags()) {
            if (args.containsOption(flag)) {
                registry.byFlag(flag).ifPresent(selected::add);
            }
        }
        if (selected.isEmpty()) {
            throw new IllegalArgumentException("You must select one source from " + describe(registry));
        }
        if (selected.size() > 1) {
            throw new IllegalArgumentException("You must select only one source from " + describe(registry));
        }

        List<String> bookIds = args.getOptionValues(BOOK_ID);
        if (bookIds == null || bookIds.isEmpty() || bookIds.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + BOOK_ID + "=<id> is required");
        }
        if (bookIds.size() > 1) {
            throw new IllegalArgumentException("--" + BOOK_ID + " given more than once");
        }

        return new ArchiveRequest(
                selected.get(0),
                bookIds.get(0).strip(),
                args.containsOption(OVERWRITE),
                args.containsOption(SHOW_INDEX),
                args.containsOption(RESCAN));
    }

    private static String describe(SourceRegistry registry) {
        return registry.flags().stream().map(flag -> "--" + flag).collect(Collectors.joining(", "));
    }
}

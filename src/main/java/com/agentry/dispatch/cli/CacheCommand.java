package com.agentry.dispatch.cli;

import com.agentry.core.cache.TieredCache;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: agentry cache
 */
@Command(name = "cache", mixinStandardHelpOptions = true, description = "Show, sweep or clear the cache")
@Component
public class CacheCommand implements Runnable {

    @Option(names = "--clear", description = "Remove cached entries")
    private boolean clear;

    @Option(names = "--category", description = "Limit --clear to one category (e.g. context)")
    private String category;

    @Option(names = "--sweep", description = "Purge expired entries now")
    private boolean sweep;

    private final TieredCache cache;

    public CacheCommand(TieredCache cache) {
        this.cache = cache;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (clear) {
            if (category != null) {
                int removed = cache.clear(category);
                ConsoleOutput.success("Cleared " + removed + " entries in category " + category);
            } else {
                cache.clear();
                ConsoleOutput.success("Cache cleared");
            }
        }
        if (sweep) {
            ConsoleOutput.success("Swept " + cache.sweep() + " expired entries");
        }
        ConsoleOutput.info(cache.status());
    }
}

package io.lunacore.setup;

import io.lunacore.memory.MemorySeedLoader;
import io.lunacore.memory.SeedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command-line maintenance run before the service starts taking traffic.
 *
 * <ul>
 *   <li>{@code --reset} clears memories, turns and sessions and compacts storage</li>
 *   <li>{@code --reset-knowledge} with {@code --reset} also clears documents and chunks</li>
 *   <li>{@code --seed-memories=<csv>} loads pinned facts from a key,value CSV</li>
 *   <li>{@code --reset-memories} with {@code --seed-memories} deletes existing memories first</li>
 * </ul>
 */
@Component
public class MaintenanceRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceRunner.class);
    private static final String SEED_FLAG = "--seed-memories=";

    private final ResetService resetService;
    private final MemorySeedLoader seedLoader;

    public MaintenanceRunner(ResetService resetService, MemorySeedLoader seedLoader) {
        this.resetService = resetService;
        this.seedLoader = seedLoader;
    }

    @Override
    public void run(String... args) {
        List<String> arguments = Arrays.asList(args);

        if (arguments.contains("--reset")) {
            resetService.resetAll(arguments.contains("--reset-knowledge"));
        }

        Optional<String> seedPath = arguments.stream()
                .filter(arg -> arg.startsWith(SEED_FLAG))
                .map(arg -> arg.substring(SEED_FLAG.length()))
                .findFirst();
        if (seedPath.isPresent()) {
            SeedResult result = seedLoader.load(Path.of(seedPath.get()), arguments.contains("--reset-memories"));
            log.info("Loaded/updated pinned memories: {}; pruned non-pinned: {}", result.loaded(), result.pruned());
        }
    }
}

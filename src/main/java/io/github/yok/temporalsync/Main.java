package io.github.yok.temporalsync;

import com.google.common.base.Splitter;
import io.github.yok.temporalsync.config.ConnectionConfig;
import io.github.yok.temporalsync.config.SyncConfig;
import io.github.yok.temporalsync.config.TableJobConfig;
import io.github.yok.temporalsync.core.SyncJobRunner;
import io.github.yok.temporalsync.util.ErrorHandler;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options and invokes {@link SyncJobRunner}.
 * </p>
 *
 * <ul>
 * <li>{@code --asof yyyy-MM-dd} or {@code -a yyyy-MM-dd} sets the as-of date stamped on every
 * version written by this execution. Defaults to today.</li>
 * <li>{@code --tables [t1,t2,…]} or {@code -t [t1,t2,…]} restricts the run to the given table job
 * ids. If omitted, all jobs of {@code application.yml} run.</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link ConnectionConfig}, {@link SyncConfig} and {@link TableJobConfig} from
 * {@code application.yml} and passes them to {@link SyncJobRunner}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionConfig
 * @see SyncConfig
 * @see TableJobConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, SyncConfig.class, TableJobConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final ConnectionConfig connectionConfig;
    private final SyncConfig syncConfig;
    private final TableJobConfig tableJobConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        LocalDate asOf = LocalDate.now();
        List<String> tableIds = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--asof":
                case "-a":
                    if (i + 1 >= args.length) {
                        ErrorHandler.errorAndExit("--asof requires a date (yyyy-MM-dd).");
                        return;
                    }
                    try {
                        asOf = LocalDate.parse(args[++i]);
                    } catch (DateTimeParseException e) {
                        ErrorHandler.errorAndExit("Invalid --asof date: " + args[i], e);
                        return;
                    }
                    break;
                case "--tables":
                case "-t":
                    if (i + 1 < args.length) {
                        tableIds = Splitter.on(',').trimResults().omitEmptyStrings()
                                .splitToList(args[++i]);
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        log.info("AsOf: {}, Tables: {}", asOf, tableIds.isEmpty() ? "ALL" : tableIds);

        try {
            new SyncJobRunner(connectionConfig, syncConfig, tableJobConfig).execute(asOf,
                    tableIds);
        } catch (Exception e) {
            log.error("Fatal error occurred (asOf={}): {}", asOf, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }
}

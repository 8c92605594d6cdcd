package io.github.yok.temporalsync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.temporalsync.config.ConnectionConfig;
import io.github.yok.temporalsync.config.SyncConfig;
import io.github.yok.temporalsync.config.TableJobConfig;
import io.github.yok.temporalsync.core.SyncJobRunner;
import io.github.yok.temporalsync.util.ErrorHandler;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private Main main;

    @BeforeEach
    void setup() {
        ConnectionConfig connectionConfig = new ConnectionConfig();
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId("dw");
        entry.setUrl("jdbc:h2:mem:main");
        connectionConfig.setConnections(List.of(entry));
        main = new Main(connectionConfig, new SyncConfig(), new TableJobConfig());
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(null);

                    Object arg0 = ctx.arguments().get(0);
                    assertTrue(arg0 instanceof Class<?>[]);
                    Class<?>[] sources = (Class<?>[]) arg0;
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"--asof", "2024-01-31"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("--asof"), eq("2024-01-31"));
        }
    }

    @Test
    void run_正常ケース_基準日とテーブルを指定する_ランナーに渡されること() {
        try (MockedConstruction<SyncJobRunner> mocked = mockConstruction(SyncJobRunner.class)) {
            main.run("-a", "2024-01-31", "--tables", " notas, ,capacidade ", "--verbose");

            SyncJobRunner runner = mocked.constructed().get(0);
            verify(runner).execute(LocalDate.of(2024, 1, 31), List.of("notas", "capacidade"));
        }
    }

    @Test
    void run_正常ケース_引数なし_今日の日付で全テーブルが対象になること() {
        try (MockedConstruction<SyncJobRunner> mocked = mockConstruction(SyncJobRunner.class)) {
            main.run();

            SyncJobRunner runner = mocked.constructed().get(0);
            verify(runner).execute(LocalDate.now(), List.of());
        }
    }

    @Test
    void run_異常ケース_基準日の値がない_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<SyncJobRunner> runners =
                        mockConstruction(SyncJobRunner.class)) {
            mocked.when(() -> ErrorHandler.errorAndExit(anyString())).thenAnswer(inv -> {
                throw new IllegalStateException("exit");
            });

            assertThrows(IllegalStateException.class, () -> main.run("--asof"));

            mocked.verify(() -> ErrorHandler.errorAndExit("--asof requires a date (yyyy-MM-dd)."));
            assertTrue(runners.constructed().isEmpty());
        }
    }

    @Test
    void run_異常ケース_基準日の形式が不正_ErrorHandlerが原因付きで呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<SyncJobRunner> runners =
                        mockConstruction(SyncJobRunner.class)) {
            main.run("--asof", "31/01/2024");

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("Invalid --asof date: 31/01/2024"),
                    any(DateTimeParseException.class)));
            assertTrue(runners.constructed().isEmpty());
        }
    }

    @Test
    void run_異常ケース_ランナーが例外を送出する_ErrorHandlerが呼ばれること() {
        IllegalStateException failure = new IllegalStateException("Unknown table job(s): [x]");
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<SyncJobRunner> runners = mockConstruction(SyncJobRunner.class,
                        (mock, ctx) -> doThrow(failure).when(mock).execute(any(), any()))) {
            main.run("-t", "x");

            mocked.verify(() -> ErrorHandler
                    .errorAndExit("Fatal error: Unknown table job(s): [x]", failure));
            assertEquals(1, runners.constructed().size());
        }
    }
}

package com.musicinsights.itunesinsights.bootstrap;

import com.musicinsights.itunesinsights.application.ingest.LibraryIndexService;
import com.musicinsights.itunesinsights.application.ingest.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * 라이브러리 export를 색인하는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code ingest}일 때만 활성화된다.</p>
 * <p>흐름: export 읽기 → 정규화 → 집계 → 배치 upsert → 요약/종료 코드</p>
 * <p>옵션이 아닌 첫 번째 인자가 있으면 {@code library.export-path} 대신 그 경로를 사용한다.</p>
 */
@Component
@Profile("ingest")
public class LibraryIndexRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(LibraryIndexRunner.class);

    private final LibraryIndexService indexService;

    private volatile int exitCode = 0;

    public LibraryIndexRunner(LibraryIndexService indexService) {
        this.indexService = indexService;
    }

    /**
     * 파이프라인을 한 번 실행하고 끝날 때까지 {@code block()}으로 대기합니다.
     *
     * @param args 커맨드라인 인자
     */
    @Override
    public void run(String... args) {
        Path override = Arrays.stream(args)
                .filter(a -> a != null && !a.isBlank() && !a.startsWith("--"))
                .findFirst()
                .map(Path::of)
                .orElse(null);

        RunSummary summary = (override == null ? indexService.run() : indexService.run(override)).block();
        if (summary == null) {
            throw new IllegalStateException("Pipeline finished without a summary");
        }

        exitCode = summary.exitCode();
        log.info("Library indexing finished: state={}, exitCode={}", summary.state(), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

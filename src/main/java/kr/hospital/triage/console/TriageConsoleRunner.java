package kr.hospital.triage.console;

import kr.hospital.triage.application.port.in.TriageUseCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "triage.console.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class TriageConsoleRunner implements CommandLineRunner {

    private final TriageUseCase triageUseCase;

    @Override
    public void run(String... args) {
        log.info("대화형 접수 콘솔 시작");

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        ConsolePrompt prompt = new ConsolePrompt(in, System.out);
        new TriageConsole(triageUseCase, prompt, System.out).run();

        log.info("대화형 접수 콘솔 종료");
    }
}

package kr.hospital.triage.console;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * 콘솔 입력 도우미
 * 잘못된 입력은 오류를 출력하고 다시 묻는다
 */
public class ConsolePrompt {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompt(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    /**
     * 정수를 입력받는다. min/max 가 null 이면 해당 방향으로 제한 없음.
     */
    public int readInt(String prompt, Integer min, Integer max) {
        while (true) {
            String raw = readLine(prompt);
            if (raw.isEmpty()) {
                error("입력값이 비어있습니다.");
                continue;
            }

            int value;
            try {
                value = Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                error("숫자를 입력해주세요.");
                continue;
            }

            if (min != null && value < min) {
                error("값이 너무 작습니다. " + min + " 이상 입력해주세요.");
                continue;
            }
            if (max != null && value > max) {
                error("값이 너무 큽니다. " + max + " 이하로 입력해주세요.");
                continue;
            }
            return value;
        }
    }

    public int readInt(String prompt) {
        return readInt(prompt, null, null);
    }

    public String readNonEmpty(String prompt) {
        while (true) {
            String value = readLine(prompt);
            if (!value.isEmpty()) {
                return value;
            }
            error("입력값이 비어있습니다. 다시 입력해주세요.");
        }
    }

    public void success(String message) {
        out.println("[OK] " + message);
    }

    public void error(String message) {
        out.println("[ERROR] " + message);
    }

    private String readLine(String prompt) {
        out.print("  > " + prompt);
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                throw new ConsoleInputClosedException();
            }
            return line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("콘솔 입력을 읽을 수 없습니다", e);
        }
    }
}

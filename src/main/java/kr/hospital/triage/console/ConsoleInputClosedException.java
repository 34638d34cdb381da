package kr.hospital.triage.console;

/**
 * 콘솔 입력 스트림이 끝났을 때 발생하는 예외 (세션 종료 신호)
 */
public class ConsoleInputClosedException extends RuntimeException {

    public ConsoleInputClosedException() {
        super("콘솔 입력이 종료되었습니다");
    }
}

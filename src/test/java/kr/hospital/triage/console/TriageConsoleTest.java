package kr.hospital.triage.console;

import kr.hospital.triage.application.service.TriageService;
import kr.hospital.triage.domain.session.TriageSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TriageConsoleTest {

    private ByteArrayOutputStream buffer;
    private TriageSession session;

    private String run(Integer capacity, String input) {
        buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        session = TriageSession.withCapacity(capacity);
        ConsolePrompt prompt = new ConsolePrompt(new BufferedReader(new StringReader(input)), out);

        new TriageConsole(new TriageService(session), prompt, out).run();
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("자동 입력 시나리오: 3명 접수, 1명 진료, 전체 보기, 종료")
    void scriptedSession() {
        // given
        String input = String.join("\n",
                "1", "John", "101", "3",
                "1", "Sarah", "102", "4",
                "1", "Mike", "103", "2",
                "2",
                "7",
                "9") + "\n";

        // when
        String output = run(5, input);

        // then
        assertThat(output).contains("[OK] 환자 'John' (ID: 101) 접수 완료 - 접수 #1");
        assertThat(output).contains("[OK] 환자 'Mike' (ID: 103) 접수 완료 - 접수 #3");
        assertThat(output).contains("[OK] 진료 호출: John");

        String table = output.substring(output.indexOf("전체 대기열 (앞 -> 뒤)"));
        assertThat(table).contains("Sarah").contains("Mike").doesNotContain("John");
        assertThat(table.indexOf("Sarah")).isLessThan(table.indexOf("Mike"));
        assertThat(table).contains("[**** ]").contains("[**   ]");
        assertThat(table).contains("대기열 전체 환자 수: 2");
        assertThat(output).contains("이용해 주셔서 감사합니다.");

        assertThat(session.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("가득 찬 대기열에 접수하면 오류를 출력하고 계속 진행한다")
    void admitWhenFull() {
        // given
        String input = String.join("\n",
                "1", "John", "101", "3",
                "1", "Sarah", "102", "4",
                "5",
                "9") + "\n";

        // when
        String output = run(1, input);

        // then
        assertThat(output).contains("[ERROR] 접수 실패 - 대기열이 가득 찼습니다!");
        assertThat(output).contains("[ERROR] 대기열이 가득 찼습니다! 1/1명");
        assertThat(output).contains("상태:           가득참");
        assertThat(session.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("빈 대기열에서 진료 호출, 맨 앞/맨 뒤 보기, 통계는 오류를 출력한다")
    void emptyQueueOperations() {
        // given
        String input = String.join("\n", "2", "3", "4", "6", "8", "9") + "\n";

        // when
        String output = run(null, input);

        // then
        assertThat(output).contains("[ERROR] 진료 호출 불가 - 대기열이 비어있습니다!");
        assertThat(output).contains("[ERROR] 대기열이 비어있습니다! 대기 중인 환자가 없습니다.");
        assertThat(output).contains("[ERROR] 통계를 계산할 환자가 없습니다.");
        assertThat(output).contains("최대 수용 인원: 무제한");
    }

    @Test
    @DisplayName("잘못된 입력은 오류를 출력하고 다시 묻는다")
    void invalidInputReprompts() {
        // given: 빈 입력, 문자, 범위 밖 메뉴, 빈 이름, 범위 밖 중증도
        String input = String.join("\n",
                "", "abc", "0", "10",
                "1", "", "Kim", "x7", "7", "6", "5",
                "4",
                "9") + "\n";

        // when
        String output = run(3, input);

        // then
        assertThat(output).contains("[ERROR] 입력값이 비어있습니다.");
        assertThat(output).contains("[ERROR] 숫자를 입력해주세요.");
        assertThat(output).contains("[ERROR] 값이 너무 작습니다. 1 이상 입력해주세요.");
        assertThat(output).contains("[ERROR] 값이 너무 큽니다. 9 이하로 입력해주세요.");
        assertThat(output).contains("[ERROR] 입력값이 비어있습니다. 다시 입력해주세요.");
        assertThat(output).contains("[ERROR] 값이 너무 큽니다. 5 이하로 입력해주세요.");
        assertThat(output).contains("[OK] 환자 'Kim' (ID: 7) 접수 완료 - 접수 #1");
        assertThat(output).contains("중증도:    5/5");
    }

    @Test
    @DisplayName("입력이 끝나면 예외 없이 세션을 종료한다")
    void endOfInputExits() {
        // when
        String output = run(2, "1\nJohn\n");

        // then
        assertThat(output).contains("환자 이름: ");
        assertThat(session.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("중증도 막대는 0~5 범위로 잘린다")
    void severityBar() {
        assertThat(TriageConsole.severityBar(3)).isEqualTo("[***  ]");
        assertThat(TriageConsole.severityBar(0)).isEqualTo("[     ]");
        assertThat(TriageConsole.severityBar(9)).isEqualTo("[*****]");
    }
}

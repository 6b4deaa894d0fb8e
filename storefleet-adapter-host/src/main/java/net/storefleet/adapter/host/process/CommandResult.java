package net.storefleet.adapter.host.process;

/**
 * 외부 명령 실행 결과. stderr 는 stdout 에 합쳐져 있다.
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {
    /** 타임아웃으로 강제 종료된 프로세스의 종료 코드 */
    public static final int TIMEOUT_EXIT = 124;

    public static CommandResult timeout(String partial) {
        return new CommandResult(TIMEOUT_EXIT, partial, true);
    }

    public boolean ok() { return exitCode == 0 && !timedOut; }

    /** 오류 메시지용 출력 꼬리 */
    public String tail(int maxChars) {
        if (output == null) return "";
        String s = output.strip();
        return s.length() <= maxChars ? s : s.substring(s.length() - maxChars);
    }
}

package io.github.hongjungwan.fieldlog.api;

/**
 * 알 수 없는 레벨 이름. 설정 오류로 간주되어 로거 생성 시점에 던져진다.
 */
public class InvalidLevelException extends IllegalArgumentException {

    private final String level;

    public InvalidLevelException(String level) {
        super("cannot parse level=" + level + ", supported levels: " + Level.labels());
        this.level = level;
    }

    public String getLevel() {
        return level;
    }
}

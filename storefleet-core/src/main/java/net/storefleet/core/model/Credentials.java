package net.storefleet.core.model;

/** 시도(attempt)마다 새로 생성되는 테넌트 자격 증명. 평문은 로그에 남기지 않는다. */
public record Credentials(
        String dbName,
        String dbUser,
        String dbPassword,
        String dbRootPassword,
        String adminUser,
        String adminPassword
) {
    @Override
    public String toString() {
        return "Credentials{dbName='" + dbName + "', dbUser='" + dbUser
                + "', adminUser='" + adminUser + "', passwords=***}";
    }
}

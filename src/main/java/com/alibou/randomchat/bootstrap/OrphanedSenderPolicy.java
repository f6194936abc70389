package com.alibou.randomchat.bootstrap;

/** Что делать при загрузке с сообщением, у которого нет записи отправителя. */
public enum OrphanedSenderPolicy {
    /** пропустить сообщение, чат грузить дальше */
    SKIP,
    /** остальные сообщения этого чата не грузить */
    ABORT_CHAT,
    /** прервать старт с InconsistentStateException */
    FAIL
}

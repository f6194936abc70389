package com.alibou.randomchat.logging;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/** DEBUG-трасса всех public-методов {@code @Service}. */
@Slf4j
@Aspect
@Configuration
public class ServiceLoggingAspect {

    private static final int MAX_TEXT = 80;

    @Around("within(@org.springframework.stereotype.Service *)")
    public Object logAround(ProceedingJoinPoint pjp) throws Throwable {
        if (!log.isDebugEnabled()) {
            return pjp.proceed();
        }

        String name = pjp.getSignature().getDeclaringType().getSimpleName()
                + "." + pjp.getSignature().getName();
        long start = System.nanoTime();
        log.debug("ВХОД  {}({})", name, argList(pjp.getArgs()));

        try {
            Object result = pjp.proceed();
            log.debug("ВЫХОД {} → {} ({} мкс)", name, shorten(result), (System.nanoTime() - start) / 1_000);
            return result;
        } catch (Throwable ex) {
            log.warn("ОШИБКА {} – {}", name, ex.toString());
            throw ex;
        }
    }

    private String argList(Object[] args) {
        if (args == null || args.length == 0) return "";
        return Arrays.stream(args).map(this::shorten).collect(Collectors.joining(", "));
    }

    /** Короткий вид: длинные тексты обрезаются, чтобы не засорять лог. */
    String shorten(Object o) {
        if (o == null) return "null";
        if (o instanceof Number || o instanceof Boolean || o instanceof Enum<?>) return o.toString();
        if (o instanceof String s) {
            return s.length() <= MAX_TEXT
                    ? "\"" + s + "\""
                    : "\"" + s.substring(0, MAX_TEXT - 1) + "…\"(" + s.length() + ")";
        }
        if (o instanceof Optional<?> opt) {
            return opt.map(v -> "Optional[" + shorten(v) + "]").orElse("Optional.empty");
        }
        if (o instanceof Collection<?> c) return c.getClass().getSimpleName() + "(size=" + c.size() + ")";
        if (o instanceof Map<?, ?> m)    return m.getClass().getSimpleName() + "(size=" + m.size() + ")";
        if (o instanceof Record)         return o.getClass().getSimpleName();
        return o.toString().length() <= MAX_TEXT ? o.toString() : o.getClass().getSimpleName();
    }
}

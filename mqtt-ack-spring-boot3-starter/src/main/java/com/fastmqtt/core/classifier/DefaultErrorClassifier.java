package com.fastmqtt.core.classifier;

import com.fastmqtt.core.spi.ErrorClassifier;
import com.fastmqtt.exception.BusinessException;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 默认错误分级
 * 展开 cause 链, 命中 BusinessException 或配置的业务异常类型即视为可忽略
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    private final Set<Class<? extends Throwable>> ignorableTypes = new LinkedHashSet<>();

    public DefaultErrorClassifier() {
        this(Set.of());
    }

    public DefaultErrorClassifier(Set<Class<? extends Throwable>> extraIgnorable) {
        this.ignorableTypes.add(BusinessException.class);
        if (extraIgnorable != null) {
            this.ignorableTypes.addAll(extraIgnorable);
        }
    }

    @Override
    public boolean isIgnorable(Throwable t) {
        // 先本体, 再逐级cause; 防止自引用死循环
        for (Throwable e = t; e != null; e = e.getCause() == e ? null : e.getCause()) {
            if (matches(e)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(Throwable e) {
        for (Class<? extends Throwable> type : ignorableTypes) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }
}

package com.pipeline.factor.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 配置校验结果：错误使结果无效，警告仅作提示
 */
public class ValidationResult implements Serializable {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    /** 条件不成立时记录错误 */
    public ValidationResult check(boolean condition, String error) {
        if (!condition) {
            errors.add(error);
        }
        return this;
    }

    public boolean isValid() { return errors.isEmpty(); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

    @Override
    public String toString() {
        return isValid() ? "valid" + (warnings.isEmpty() ? "" : " with warnings " + warnings)
                : "invalid: " + errors;
    }
}

package dev.transput.format;

/**
 * 由格式编译器捕获的词法环境；对本引擎不透明，只在求值动态计数或子格式时原样交还给 evaluator。
 */
public interface Environment {
    Environment EMPTY = new Environment() {
        @Override
        public String toString() {
            return "Environment.EMPTY";
        }
    };
}

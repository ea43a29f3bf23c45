package com.ddm.metis.loader;

import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 解析 {@code KEY=value} 格式的覆盖文件。
 *
 * <p>支持：
 * <ul>
 *   <li>{@code #} 开头的注释行与空行</li>
 *   <li>可选的 {@code export } 前缀</li>
 *   <li>单引号或双引号包裹的值（双引号内支持 {@code \n} 转义）</li>
 *   <li>未加引号的值中 {@code " #"} 之后视为行尾注释</li>
 * </ul>
 * 同一文件中重复的键以后出现的为准。
 *
 * @author liyifei
 */
final class EnvFileParser {

    private static final Pattern KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Pattern TRAILING_COMMENT = Pattern.compile("\\s+#.*");
    private static final String EXPORT = "export ";

    private EnvFileParser() {
    }

    static Result<Map<String, String>> parse(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return Result.failure(ConfigError.sourceLoad(file.toString(), "cannot read file", e));
        }
        return parse(file.toString(), lines);
    }

    static Result<Map<String, String>> parse(String name, List<String> lines) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            int lineNo = i + 1;
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith(EXPORT)) {
                line = line.substring(EXPORT.length()).trim();
            }
            int eq = line.indexOf('=');
            if (eq < 0) {
                return malformed(name, lineNo, "expected KEY=value");
            }
            String key = line.substring(0, eq).trim();
            if (!KEY.matcher(key).matches()) {
                return malformed(name, lineNo, "invalid key '" + key + "'");
            }
            String value = line.substring(eq + 1).trim();
            if (value.startsWith("\"") || value.startsWith("'")) {
                char quote = value.charAt(0);
                int end = value.indexOf(quote, 1);
                if (end < 0) {
                    return malformed(name, lineNo, "unterminated quote");
                }
                String rest = value.substring(end + 1);
                if (!rest.isBlank() && !TRAILING_COMMENT.matcher(rest).matches()) {
                    return malformed(name, lineNo, "unexpected text after closing quote");
                }
                value = value.substring(1, end);
                if (quote == '"') {
                    value = value.replace("\\n", "\n");
                }
            } else {
                int comment = value.indexOf(" #");
                if (comment >= 0) {
                    value = value.substring(0, comment).trim();
                }
            }
            out.put(key, value);
        }
        return Result.success(out);
    }

    private static Result<Map<String, String>> malformed(String name, int lineNo, String reason) {
        return Result.failure(ConfigError.sourceLoad(name, "line " + lineNo + ": " + reason));
    }
}

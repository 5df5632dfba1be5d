package com.security.logle.constants;

import java.util.Arrays;
import java.util.List;

/**
 * 日志分析相关常量定义
 */
public final class LogleConstants {

    private LogleConstants() {
        // 工具类，防止实例化
    }

    /**
     * 分析器名称
     */
    public static final class AnalyzerName {
        private AnalyzerName() {}

        /** 进程依赖分析（JSON） */
        public static final String CURIO = "curio";

        /** 邮箱账户访问分析（CSV） */
        public static final String MAIL = "mail";

        /** Plaso 事件分析（JSON / JSON 流） */
        public static final String PLASO = "plaso";

        public static final List<String> ALL = Arrays.asList(CURIO, MAIL, PLASO);
    }

    /**
     * 错误信息
     */
    public static final class ErrorMessage {
        private ErrorMessage() {}

        public static final String INVALID_ANALYZER =
                "Invalid analysis. The analysis must be one of 'curio', 'mail', or 'plaso'.";

        public static final String OPEN_FILE = "Error opening file: ";
        public static final String WRITE_FILE = "Error writing to file: ";
        public static final String CLOSE_FILE = "Error closing file: ";

        public static final String MAIL_REQUIRES_CSV = "The access analyzer requires a CSV input file.";
        public static final String CURIO_REQUIRES_JSON = "The Curio analyzer requires a JSON input file.";
        public static final String PLASO_REQUIRES_JSON =
                "The Plaso analyzer requires a JSON or JSON stream input file.";
    }

    /**
     * 邮箱访问日志（CSV 列名与图标签）
     */
    public static final class Mail {
        private Mail() {}

        /** CSV 列名 */
        public static final String COLUMN_USER = "user";
        public static final String COLUMN_ACCOUNT = "account";
        public static final String COLUMN_ACCESS_TYPE = "access_type";
        public static final String COLUMN_TIMESTAMP = "timestamp";
        public static final String COLUMN_IP = "ip";

        public static final List<String> REQUIRED_COLUMNS = Arrays.asList(
            COLUMN_USER, COLUMN_ACCOUNT, COLUMN_ACCESS_TYPE, COLUMN_TIMESTAMP
        );

        /** 节点标签 */
        public static final String TAG_ACTOR = "actor";
        public static final String TAG_ACCOUNT = "account";
        public static final String TAG_ADDRESS = "address";

        /** 边标签 */
        public static final String TAG_ACCESS = "access";
        public static final String TAG_LOCATION = "location";
    }

    /**
     * Curio 进程依赖（JSON 字段与图标签）
     */
    public static final class Curio {
        private Curio() {}

        public static final String FIELD_DEPENDENCIES = "dependencies";
        public static final String FIELD_SOURCE = "source";
        public static final String FIELD_TARGET = "target";
        public static final String FIELD_TYPE = "type";
        public static final String FIELD_NAME = "name";
        public static final String FIELD_PID = "pid";

        public static final String TAG_PROCESS = "process";
        public static final String TAG_DEPENDENCY = "dependency";
    }

    /**
     * Plaso 事件（JSON 字段与图标签）
     */
    public static final class Plaso {
        private Plaso() {}

        public static final String FIELD_TIMESTAMP = "timestamp";
        public static final String FIELD_DATA_TYPE = "data_type";
        public static final String FIELD_DISPLAY_NAME = "display_name";
        public static final String FIELD_FILENAME = "filename";
        public static final String FIELD_PARSER = "parser";

        public static final String TAG_EVENT = "event";
        public static final String TAG_FILE = "file";
        public static final String TAG_SOURCE = "source";

        public static final String TAG_EVENT_FILE = "event_file";
        public static final String TAG_EVENT_SOURCE = "event_source";

        /** event_file 边上的文件角色 */
        public static final String ROLE_DISPLAY_NAME = "display_name";
        public static final String ROLE_FILENAME = "filename";
    }
}

// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.hyperprune.common;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileReader;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.reflect.Field;
import java.util.Arrays;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ConfigBase {
    private static final Logger LOG = LogManager.getLogger(ConfigBase.class);

    // matches "${NAME}" and "$NAME"
    private static final Pattern ENV_PATTERN = Pattern.compile("\\$\\{([^}]*)\\}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    @Retention(RetentionPolicy.RUNTIME)
    public @interface ConfField {
        boolean mutable() default false;

        String description() default "";
    }

    private static String confFile;
    public static Class<? extends ConfigBase> confClass;
    public static Map<String, Field> confFields;

    public void init(String configFile) throws Exception {
        confClass = this.getClass();
        confFile = configFile;
        confFields = Maps.newHashMap();
        for (Field field : confClass.getFields()) {
            ConfField confField = field.getAnnotation(ConfField.class);
            if (confField == null) {
                continue;
            }
            confFields.put(field.getName(), field);
        }

        if (!Strings.isNullOrEmpty(confFile)) {
            initConf(confFile);
        }
    }

    private void initConf(String confFile) throws Exception {
        Properties props = new Properties();
        try (FileReader fr = new FileReader(confFile)) {
            props.load(fr);
        }
        replacedByEnv(props);
        setFields(props);
        LOG.info("loaded config from {}", confFile);
    }

    public static Map<String, String> dump() {
        Map<String, String> map = new TreeMap<>();
        for (Field f : confClass.getFields()) {
            if (f.getAnnotation(ConfField.class) != null) {
                map.put(f.getName(), getConfValue(f));
            }
        }
        return map;
    }

    public static String getConfValue(Field field) {
        try {
            if (field.getType().isArray()) {
                switch (field.getType().getSimpleName()) {
                    case "int[]":
                        return Arrays.toString((int[]) field.get(null));
                    case "long[]":
                        return Arrays.toString((long[]) field.get(null));
                    default:
                        return Arrays.toString((Object[]) field.get(null));
                }
            }
            return String.valueOf(field.get(null));
        } catch (IllegalAccessException e) {
            return String.format("Failed to get config %s: %s", field.getName(), e.getMessage());
        }
    }

    // a value like "${CONFIG_VALUE}/conf" or "$CONFIG_VALUE/conf" is resolved against
    // system properties first and then the environment.
    private void replacedByEnv(Properties props) throws Exception {
        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key);
            Matcher m = ENV_PATTERN.matcher(value);
            StringBuffer sb = new StringBuffer();
            while (m.find()) {
                String name = m.group(1) != null ? m.group(1) : m.group(2);
                String envValue = System.getProperty(name);
                envValue = (envValue != null) ? envValue : System.getenv(name);
                if (envValue == null) {
                    throw new Exception("no such env variable: " + name);
                }
                m.appendReplacement(sb, Matcher.quoteReplacement(envValue));
            }
            m.appendTail(sb);
            props.setProperty(key, sb.toString());
        }
    }

    private static void setFields(Properties props) throws Exception {
        for (Field f : confClass.getFields()) {
            if (f.getAnnotation(ConfField.class) == null) {
                continue;
            }

            String confVal = props.getProperty(f.getName());
            if (Strings.isNullOrEmpty(confVal)) {
                continue;
            }

            setConfigField(f, confVal);
        }
    }

    private static void setConfigField(Field f, String confVal) throws Exception {
        confVal = confVal.trim();

        String[] sa = confVal.split(",");
        for (int i = 0; i < sa.length; i++) {
            sa[i] = sa[i].trim();
        }

        switch (f.getType().getSimpleName()) {
            case "int":
                f.setInt(null, Integer.parseInt(confVal));
                break;
            case "long":
                f.setLong(null, Long.parseLong(confVal));
                break;
            case "double":
                f.setDouble(null, Double.parseDouble(confVal));
                break;
            case "boolean":
                if (isBoolean(confVal)) {
                    f.setBoolean(null, Boolean.parseBoolean(confVal));
                }
                break;
            case "String":
                f.set(null, confVal);
                break;
            case "String[]":
                f.set(null, sa);
                break;
            default:
                throw new Exception("unknown type: " + f.getType().getSimpleName());
        }
    }

    private static boolean isBoolean(String s) {
        if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")) {
            return true;
        }
        throw new IllegalArgumentException("type mismatch");
    }

    public static synchronized void setMutableConfig(String key, String value) throws UserException {
        Field field = confFields == null ? null : confFields.get(key);
        if (field == null) {
            throw new UserException("Config '" + key + "' does not exist");
        }

        ConfField anno = field.getAnnotation(ConfField.class);
        if (!anno.mutable()) {
            throw new UserException("Config '" + key + "' is not mutable");
        }

        try {
            setConfigField(field, value);
        } catch (Exception e) {
            throw new UserException("Failed to set config '" + key + "'. err: " + e.getMessage(), e);
        }

        LOG.info("set config {} to {}", key, value);
    }
}

package com.codelogickeep.coverage.parser;

/**
 * 发往解析 worker 的消息
 *
 * @param content LCOV 原文
 * @param source  来源描述（文件路径或 "<string>"），仅用于日志
 */
record ParseRequest(String content, String source) {
}

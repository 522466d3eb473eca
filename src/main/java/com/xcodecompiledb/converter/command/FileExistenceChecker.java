package com.xcodecompiledb.converter.command;

/**
 * 判断 -include 引用的路径在磁盘上是否存在。
 * 只用于区分"原始头文件"和"PCH 产物路径"，测试里可以替换成假实现。
 */
@FunctionalInterface
public interface FileExistenceChecker {

    boolean exists(String path);
}

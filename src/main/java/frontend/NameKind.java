package frontend;

// 名字的种类：普通标识符（变量、函数、枚举常量）或 typedef 类型名
public enum NameKind {
    ORDINARY,
    TYPEDEF
}

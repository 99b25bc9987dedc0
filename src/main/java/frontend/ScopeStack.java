package frontend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// 作用域栈：文件作用域始终在栈底，Lexer 只查询，Parser 负责进出和声明
public class ScopeStack {
    private static final Logger log = LoggerFactory.getLogger(ScopeStack.class);

    private Scope currentScope; // 当前（最内层）作用域
    private int scopeCounter = 1; // 作用域计数器，文件作用域序号为1
    private int depth = 1;

    public ScopeStack() {
        this.currentScope = new Scope(null, scopeCounter);
    }

    public void pushScope() {
        scopeCounter++;
        depth++;
        currentScope = new Scope(currentScope, scopeCounter);
        log.trace("enter scope {} (depth {})", scopeCounter, depth);
    }

    public void popScope() {
        if (currentScope.parentScope == null) {
            throw new IllegalStateException("cannot pop the file scope");
        }
        log.trace("exit scope {} (depth {})", currentScope.getScopeLevel(), depth);
        currentScope = currentScope.parentScope;
        depth--;
    }

    public Symbol declare(String name, NameKind kind, Coord coord) {
        Symbol symbol = new Symbol(name, kind, currentScope.getScopeLevel(), coord);
        currentScope.declare(symbol);
        log.debug("declare {} {} in scope {}", kind, name, symbol.scopeLevel);
        return symbol;
    }

    // 枚举常量：普通标识符，附带已知的值（未知时为 null）
    public Symbol declareConstant(String name, Long value, Coord coord) {
        Symbol symbol = new Symbol(name, NameKind.ORDINARY, currentScope.getScopeLevel(), coord, value);
        currentScope.declare(symbol);
        log.debug("declare enumerator {} = {} in scope {}", name, value, symbol.scopeLevel);
        return symbol;
    }

    public boolean isTypedef(String name) {
        Symbol symbol = currentScope.lookup(name);
        return symbol != null && symbol.isTypedef();
    }

    public Symbol lookup(String name) {
        return currentScope.lookup(name);
    }

    public Scope getCurrentScope() {
        return currentScope;
    }

    public int depth() {
        return depth;
    }
}

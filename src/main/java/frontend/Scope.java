package frontend;

import java.util.*;

// 一层作用域：文件、函数形参表或者一个块
public class Scope {
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    final Scope parentScope;
    private final int scopeLevel;

    public Scope(Scope parentScope, int scopeLevel) {
        this.parentScope = parentScope;
        this.scopeLevel = scopeLevel;
    }

    // 由内向外查找，第一个认识这个名字的作用域说了算
    public Symbol lookup(String name) {
        Symbol symbol = symbols.get(name);
        if (symbol != null) {
            return symbol;
        } else if (parentScope != null) {
            return parentScope.lookup(name);
        } else {
            return null;
        }
    }

    // 只查本层
    public Symbol lookupLocal(String name) {
        return symbols.get(name);
    }

    // 同类重复声明覆盖旧项，typedef 名和普通名字互换则冲突
    public void declare(Symbol symbol) {
        Symbol previous = symbols.get(symbol.name);
        if (previous != null && previous.kind != symbol.kind) {
            throw new DeclarationConflict(symbol.name, previous.kind, symbol.coord);
        }
        symbols.put(symbol.name, symbol);
    }

    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    public Scope getParentScope() {
        return parentScope;
    }

    public int getScopeLevel() {
        return scopeLevel;
    }
}

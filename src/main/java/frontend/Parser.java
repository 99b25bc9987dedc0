package frontend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static frontend.ASTFactory.*;

// 递归下降语法分析：声明的名字在读下一个 token 之前生效，作用域在吃掉 '}' / ')' 之前弹出
public class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final ScopeStack scopes;
    private final ConstantFolder folder;
    private Token currentToken; // 当前词法单元
    private Token previousToken; // 上一个词法单元
    private Token peekedToken; // 额外预读的一个词法单元，只在标号和类型转换处使用

    public Parser(Lexer lexer, ScopeStack scopes) {
        this.lexer = lexer;
        this.scopes = scopes;
        this.folder = new ConstantFolder(name -> {
            Symbol symbol = scopes.lookup(name);
            return symbol == null ? null : symbol.constantValue;
        });
        this.currentToken = lexer.nextToken();
    }

    // 一次完整的解析：新的作用域栈、词法分析器和语法分析器
    public static ASTNode parseSource(String source, String fileName) {
        ScopeStack scopes = new ScopeStack();
        return new Parser(new Lexer(source, fileName, scopes), scopes).parse();
    }

    public static ASTNode parseSource(String source) {
        return parseSource(source, "");
    }

    // 解析程序入口
    public ASTNode parse() {
        ASTNode root = TranslationUnit();
        log.debug("FileAST 子节点数量: {}", root.childCount());
        return root;
    }

    // ---------------------------------------------------------------- token 操作

    // 获取下一个词法单元
    private void nextToken() {
        previousToken = currentToken;
        if (peekedToken != null) {
            currentToken = peekedToken;
            peekedToken = null;
        } else {
            currentToken = lexer.nextToken();
        }
    }

    private Token peek() {
        if (peekedToken == null) {
            peekedToken = lexer.nextToken();
        }
        return peekedToken;
    }

    private void refreshLookahead() {
        currentToken = lexer.reclassify(currentToken);
        if (peekedToken != null) {
            peekedToken = lexer.reclassify(peekedToken);
        }
    }

    private boolean check(TokenType type) {
        return currentToken.type == type;
    }

    // 匹配指定的词法单元类型，成功则吃掉
    private boolean match(TokenType type) {
        if (currentToken.type == type) {
            nextToken();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String what) {
        if (currentToken.type != type) {
            throw error("expected " + what);
        }
        Token token = currentToken;
        nextToken();
        return token;
    }

    // 标签名、成员名等：typedef 名在这些位置也只是普通名字
    private Token expectName(String what) {
        if (currentToken.type != TokenType.IDENFR && currentToken.type != TokenType.TYPEID) {
            throw error("expected " + what);
        }
        Token token = currentToken;
        nextToken();
        return token;
    }

    private SyntaxError error(String detail) {
        if (currentToken.type == TokenType.EOF) {
            return new SyntaxError(detail + " at end of input", "", currentToken.getCoord());
        }
        return new SyntaxError(detail, currentToken);
    }

    private Coord coord() {
        return currentToken.getCoord();
    }

    // ---------------------------------------------------------------- 外部声明

    // TranslationUnit → { ExternalDecl }
    private ASTNode TranslationUnit() {
        Coord start = coord();
        List<ASTNode> decls = new ArrayList<>();
        while (!check(TokenType.EOF)) {
            ExternalDecl(decls);
        }
        return translationUnit(decls, start);
    }

    // ExternalDecl → FuncDef | Declaration | Pragma | ';'
    private void ExternalDecl(List<ASTNode> out) {
        if (match(TokenType.SEMICN)) {
            return;
        }
        if (check(TokenType.PRAGMA)) {
            out.add(Pragma());
            return;
        }
        DeclSpec spec = DeclSpecifiers(false);
        if (!spec.isEmpty() && check(TokenType.SEMICN)) {
            // 只有说明符，例如 enum suit {...};
            out.add(bareDeclaration(spec));
            nextToken();
            return;
        }
        Declarator first = Declarator(false);
        if (first.isFunction() && (check(TokenType.LBRACE) || isDeclSpecStart(currentToken))) {
            out.add(FuncDef(spec, first));
            return;
        }
        if (spec.isEmpty()) {
            // 只有函数定义可以省略类型（默认 int）
            throw error("missing type in declaration");
        }
        out.addAll(InitDeclaratorList(spec, first));
    }

    // FuncDef → [DeclSpecifiers] Declarator { Declaration } CompoundStmt
    private ASTNode FuncDef(DeclSpec spec, Declarator declarator) {
        if (spec.isTypedef()) {
            throw new SyntaxError("function definition declared 'typedef'", declarator.nameToken);
        }
        declareName(spec, declarator);
        ASTNode decl = buildDeclaration(spec, declarator, null, true);
        log.debug("[FuncDef] {} at {}", declarator.name(), declarator.coord);

        // 函数体作用域，先放入形参；由 CompoundStmt 在 '}' 之前弹出
        scopes.pushScope();
        for (Token param : declarator.derivations.get(0).paramNames) {
            scopes.declare(param.value, NameKind.ORDINARY, param.getCoord());
        }
        ASTNode paramDecls = null;
        if (!check(TokenType.LBRACE)) {
            // K&R 风格的形参声明表
            Coord listCoord = coord();
            List<ASTNode> decls = new ArrayList<>();
            while (!check(TokenType.LBRACE)) {
                if (!isDeclSpecStart(currentToken)) {
                    throw error("expected '{'");
                }
                decls.addAll(Declaration());
            }
            paramDecls = declList(decls, listCoord);
        }
        ASTNode body = CompoundStmt(false);
        return funcDef(declarator.name(), decl, paramDecls, body, declarator.coord);
    }

    // Declaration → DeclSpecifiers [InitDeclarator { ',' InitDeclarator }] ';'
    private List<ASTNode> Declaration() {
        DeclSpec spec = DeclSpecifiers(false);
        if (check(TokenType.SEMICN)) {
            List<ASTNode> decls = new ArrayList<>();
            decls.add(bareDeclaration(spec));
            nextToken();
            return decls;
        }
        return InitDeclaratorList(spec, Declarator(false));
    }

    // InitDeclarator → Declarator ['=' Initializer]，第一个声明符已经解析好
    private List<ASTNode> InitDeclaratorList(DeclSpec spec, Declarator first) {
        List<ASTNode> decls = new ArrayList<>();
        Declarator declarator = first;
        boolean firstOne = true;
        while (true) {
            // 名字在 '=' 之前就生效
            declareName(spec, declarator);
            ASTNode init = null;
            if (check(TokenType.ASSIGN)) {
                if (spec.isTypedef()) {
                    throw error("typedef cannot have an initializer");
                }
                nextToken();
                init = Initializer();
            }
            decls.add(buildDeclaration(spec, declarator, init, firstOne));
            firstOne = false;
            if (!match(TokenType.COMMA)) {
                break;
            }
            declarator = Declarator(false);
        }
        expect(TokenType.SEMICN, "';'");
        return decls;
    }

    private void declareName(DeclSpec spec, Declarator declarator) {
        if (declarator.nameToken != null) {
            scopes.declare(declarator.name(), spec.isTypedef() ? NameKind.TYPEDEF : NameKind.ORDINARY,
                    declarator.coord);
        }
    }

    // 说明符只在第一个声明上挂一次，保证树中没有共享节点
    private ASTNode buildDeclaration(DeclSpec spec, Declarator declarator, ASTNode init, boolean withTag) {
        ASTNode chain = buildChain(declarator.derivations);
        ASTNode tag = withTag ? spec.tag : null;
        String type = spec.isEmpty() ? "int" : spec.type();
        if (spec.isTypedef()) {
            return typedef(declarator.name(), type, spec.quals(), chain, tag, declarator.coord);
        }
        return decl(declarator.name(), type, spec.storage(), spec.quals(), spec.funcspec(), chain, tag, init,
                declarator.coord);
    }

    private ASTNode bareDeclaration(DeclSpec spec) {
        if (spec.isTypedef()) {
            return typedef(null, spec.type(), spec.quals(), null, spec.tag, spec.coord);
        }
        return decl(null, spec.type(), spec.storage(), spec.quals(), spec.funcspec(), null, spec.tag, null, spec.coord);
    }

    // ---------------------------------------------------------------- 声明说明符

    // DeclSpecifiers → { StorageClass | TypeQualifier | FunctionSpecifier | TypeSpecifier }
    // memberOnly 为 true 时是 SpecifierQualifierList（结构体成员、类型名）
    private DeclSpec DeclSpecifiers(boolean memberOnly) {
        DeclSpec spec = new DeclSpec(coord());
        while (true) {
            Token token = currentToken;
            switch (token.type) {
                case TYPEDEFTK:
                case EXTERNTK:
                case STATICTK:
                case AUTOTK:
                case REGISTERTK:
                    if (memberOnly) {
                        throw error("storage class not allowed here");
                    }
                    spec.storage.add(token.value);
                    nextToken();
                    break;
                case CONSTTK:
                case VOLATILETK:
                case RESTRICTTK:
                    spec.quals.add(token.value);
                    nextToken();
                    break;
                case INLINETK:
                    if (memberOnly) {
                        throw error("'inline' not allowed here");
                    }
                    spec.funcspec.add(token.value);
                    nextToken();
                    break;
                case VOIDTK:
                case CHARTK:
                case SHORTTK:
                case INTTK:
                case LONGTK:
                case FLOATTK:
                case DOUBLETK:
                case SIGNEDTK:
                case UNSIGNEDTK:
                case BOOLTK:
                case COMPLEXTK:
                    if (spec.tag != null || spec.typedefName) {
                        throw error("invalid multiple types specified");
                    }
                    spec.typeNames.add(token.value);
                    nextToken();
                    break;
                case STRUCTTK:
                case UNIONTK:
                    if (spec.hasType()) {
                        throw error("invalid multiple types specified");
                    }
                    spec.setTag(StructOrUnionSpecifier());
                    break;
                case ENUMTK:
                    if (spec.hasType()) {
                        throw error("invalid multiple types specified");
                    }
                    spec.setTag(EnumSpecifier());
                    break;
                case TYPEID:
                    if (spec.hasType()) {
                        // 已经有类型了，这个 typedef 名是被重新声明的名字
                        return spec;
                    }
                    spec.typeNames.add(token.value);
                    spec.typedefName = true;
                    nextToken();
                    break;
                default:
                    return spec;
            }
        }
    }

    private boolean isDeclSpecStart(Token token) {
        switch (token.type) {
            case TYPEDEFTK:
            case EXTERNTK:
            case STATICTK:
            case AUTOTK:
            case REGISTERTK:
            case INLINETK:
                return true;
            default:
                return isTypeNameStart(token);
        }
    }

    private boolean isTypeNameStart(Token token) {
        switch (token.type) {
            case CONSTTK:
            case VOLATILETK:
            case RESTRICTTK:
            case VOIDTK:
            case CHARTK:
            case SHORTTK:
            case INTTK:
            case LONGTK:
            case FLOATTK:
            case DOUBLETK:
            case SIGNEDTK:
            case UNSIGNEDTK:
            case BOOLTK:
            case COMPLEXTK:
            case STRUCTTK:
            case UNIONTK:
            case ENUMTK:
            case TYPEID:
                return true;
            default:
                return false;
        }
    }

    // StructOrUnionSpecifier → ('struct' | 'union') [Ident] ['{' { StructDeclaration } '}']
    private ASTNode StructOrUnionSpecifier() {
        Token keyword = currentToken;
        nextToken();
        String name = null;
        if (check(TokenType.IDENFR) || check(TokenType.TYPEID)) {
            name = currentToken.value;
            nextToken();
        }
        List<ASTNode> members = null;
        if (match(TokenType.LBRACE)) {
            members = new ArrayList<>();
            while (!check(TokenType.RBRACE)) {
                members.addAll(StructDeclaration());
            }
            nextToken();
        } else if (name == null) {
            throw error("expected '{'");
        }
        return keyword.type == TokenType.STRUCTTK
                ? struct(name, members, keyword.getCoord())
                : union(name, members, keyword.getCoord());
    }

    // StructDeclaration → SpecifierQualifierList [StructDeclarator { ',' StructDeclarator }] ';'
    // StructDeclarator → Declarator | [Declarator] ':' ConstantExp
    private List<ASTNode> StructDeclaration() {
        DeclSpec spec = DeclSpecifiers(true);
        if (!spec.hasType() && spec.quals.isEmpty()) {
            throw error("expected specifier-qualifier-list");
        }
        List<ASTNode> members = new ArrayList<>();
        if (match(TokenType.SEMICN)) {
            // 匿名 struct/union 成员
            members.add(member(null, spec.type(), spec.quals(), null, spec.tag, null, spec.coord));
            return members;
        }
        boolean firstOne = true;
        do {
            Declarator declarator = check(TokenType.COLON)
                    ? new Declarator(null, coord())
                    : Declarator(false);
            ASTNode bits = null;
            if (match(TokenType.COLON)) {
                bits = ConstantExp();
            }
            members.add(member(declarator.name(), spec.type(), spec.quals(), buildChain(declarator.derivations),
                    firstOne ? spec.tag : null, bits, declarator.coord));
            firstOne = false;
        } while (match(TokenType.COMMA));
        expect(TokenType.SEMICN, "';'");
        return members;
    }

    // EnumSpecifier → 'enum' [Ident] ['{' Enumerator { ',' Enumerator } [','] '}']
    // Enumerator → Ident ['=' ConstantExp]
    private ASTNode EnumSpecifier() {
        Coord start = coord();
        nextToken();
        String name = null;
        if (check(TokenType.IDENFR) || check(TokenType.TYPEID)) {
            name = currentToken.value;
            nextToken();
        }
        if (!match(TokenType.LBRACE)) {
            if (name == null) {
                throw error("expected '{'");
            }
            return enumSpec(name, null, start);
        }
        if (check(TokenType.RBRACE)) {
            throw error("expected enumerator");
        }
        List<ASTNode> enumerators = new ArrayList<>();
        Long nextValue = 0L; // 没有显式值时取上一个值加一，第一个为 0
        while (!check(TokenType.RBRACE)) {
            Token enumName = expectName("enumerator");
            ASTNode valueExpr = null;
            Long value = nextValue;
            if (match(TokenType.ASSIGN)) {
                valueExpr = ConstantExp();
                value = folder.evaluate(valueExpr);
            }
            // 枚举常量在 ',' 之前生效，后面的枚举值可以引用它
            scopes.declareConstant(enumName.value, value, enumName.getCoord());
            enumerators.add(enumerator(enumName.value, value, valueExpr, enumName.getCoord()));
            nextValue = value == null ? null : value + 1;
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(TokenType.RBRACE, "'}'");
        return enumSpec(name, enumerators, start);
    }

    // ---------------------------------------------------------------- 声明符

    // Declarator → { '*' { TypeQualifier } } DirectDeclarator
    // allowAbstract 为 true 时名字可以省略（形参、类型名）
    private Declarator Declarator(boolean allowAbstract) {
        List<Derivation> pointers = new ArrayList<>();
        while (check(TokenType.MULT)) {
            Coord star = coord();
            nextToken();
            List<String> quals = new ArrayList<>();
            while (check(TokenType.CONSTTK) || check(TokenType.VOLATILETK) || check(TokenType.RESTRICTTK)) {
                quals.add(currentToken.value);
                nextToken();
            }
            pointers.add(Derivation.pointer(String.join(" ", quals), star));
        }
        Declarator declarator = DirectDeclarator(allowAbstract);
        // 离名字最近的 '*' 最后一个出现，派生顺序要反过来
        for (int i = pointers.size() - 1; i >= 0; i--) {
            declarator.derivations.add(pointers.get(i));
        }
        return declarator;
    }

    // DirectDeclarator → (Ident | '(' Declarator ')') { ArraySuffix | FunctionSuffix }
    private Declarator DirectDeclarator(boolean allowAbstract) {
        Declarator declarator;
        if (check(TokenType.IDENFR) || check(TokenType.TYPEID)) {
            declarator = new Declarator(currentToken, currentToken.getCoord());
            nextToken();
        } else if (check(TokenType.LPARENT)) {
            Coord paren = coord();
            nextToken();
            if (allowAbstract && !startsNestedDeclarator(currentToken)) {
                // 抽象声明符中 '(' 后面是形参表，例如 int (int)
                declarator = new Declarator(null, paren);
                declarator.derivations.add(FunctionSuffix(paren));
            } else {
                declarator = Declarator(allowAbstract);
                expect(TokenType.RPARENT, "')'");
            }
        } else if (allowAbstract) {
            declarator = new Declarator(null, coord());
        } else {
            throw error("expected identifier or '('");
        }
        while (true) {
            if (check(TokenType.LBRACK)) {
                declarator.derivations.add(ArraySuffix());
            } else if (check(TokenType.LPARENT)) {
                Coord paren = coord();
                nextToken();
                declarator.derivations.add(FunctionSuffix(paren));
            } else {
                return declarator;
            }
        }
    }

    private boolean startsNestedDeclarator(Token token) {
        return token.type == TokenType.MULT || token.type == TokenType.LPARENT
                || token.type == TokenType.LBRACK || token.type == TokenType.IDENFR;
    }

    // ArraySuffix → '[' { TypeQualifier | 'static' } [AssignExp | '*'] ']'
    private Derivation ArraySuffix() {
        Coord start = coord();
        expect(TokenType.LBRACK, "'['");
        List<String> quals = new ArrayList<>();
        while (check(TokenType.CONSTTK) || check(TokenType.VOLATILETK) || check(TokenType.RESTRICTTK)
                || check(TokenType.STATICTK)) {
            quals.add(currentToken.value);
            nextToken();
        }
        ASTNode dim = null;
        if (check(TokenType.MULT) && peek().type == TokenType.RBRACK) {
            // 变长数组 [*]
            dim = id("*", coord());
            nextToken();
        } else if (!check(TokenType.RBRACK)) {
            dim = AssignExp();
        }
        expect(TokenType.RBRACK, "']'");
        return Derivation.array(String.join(" ", quals), dim, start);
    }

    // FunctionSuffix → '(' [ParamTypeList | IdentList] ')'，'(' 已经被吃掉
    // ParamTypeList → ParamDecl { ',' ParamDecl } [',' '...']
    private Derivation FunctionSuffix(Coord start) {
        scopes.pushScope(); // 形参作用域
        List<Token> names = new ArrayList<>();
        ASTNode params = null;
        if (!check(TokenType.RPARENT)) {
            Coord listCoord = coord();
            List<ASTNode> items = new ArrayList<>();
            if (check(TokenType.IDENFR)) {
                // K&R 风格的标识符表
                do {
                    Token name = expect(TokenType.IDENFR, "identifier");
                    scopes.declare(name.value, NameKind.ORDINARY, name.getCoord());
                    names.add(name);
                    items.add(id(name.value, name.getCoord()));
                } while (match(TokenType.COMMA));
            } else {
                while (true) {
                    if (check(TokenType.ELLIPSIS) && !items.isEmpty()) {
                        items.add(ellipsisParam(coord()));
                        nextToken();
                        break;
                    }
                    items.add(ParamDecl(names));
                    if (!match(TokenType.COMMA)) {
                        break;
                    }
                }
            }
            params = paramList(items, listCoord);
        }
        scopes.popScope(); // 在吃掉 ')' 之前退出形参作用域
        expect(TokenType.RPARENT, "')'");
        return Derivation.function(params, names, start);
    }

    // ParamDecl → DeclSpecifiers (Declarator | AbstractDeclarator)
    private ASTNode ParamDecl(List<Token> names) {
        if (!isDeclSpecStart(currentToken)) {
            throw error("expected parameter declaration");
        }
        DeclSpec spec = DeclSpecifiers(false);
        Declarator declarator = Declarator(true);
        if (declarator.nameToken == null) {
            return typeName(spec.type(), spec.quals(), buildChain(declarator.derivations), spec.tag, spec.coord);
        }
        declareName(spec, declarator);
        names.add(declarator.nameToken);
        return buildDeclaration(spec, declarator, null, true);
    }

    // TypeName → SpecifierQualifierList [AbstractDeclarator]
    private ASTNode TypeName() {
        DeclSpec spec = DeclSpecifiers(true);
        if (!spec.hasType() && spec.quals.isEmpty()) {
            throw error("expected type name");
        }
        Declarator declarator = Declarator(true);
        if (declarator.nameToken != null) {
            throw new SyntaxError("unexpected identifier in type name", declarator.nameToken);
        }
        return typeName(spec.type(), spec.quals(), buildChain(declarator.derivations), spec.tag, spec.coord);
    }

    // 派生列表从名字向外排列；链的根是最外层的派生
    private static ASTNode buildChain(List<Derivation> derivations) {
        ASTNode inner = null;
        for (int i = derivations.size() - 1; i >= 0; i--) {
            Derivation d = derivations.get(i);
            switch (d.kind) {
                case PTR_DECL:
                    inner = ptrDecl(d.quals, inner, d.coord);
                    break;
                case ARRAY_DECL:
                    inner = arrayDecl(d.quals, inner, d.dim, d.coord);
                    break;
                case FUNC_DECL:
                    inner = funcDecl(inner, d.params, d.coord);
                    break;
                default:
                    throw new IllegalStateException("not a derived type: " + d.kind);
            }
        }
        return inner;
    }

    // ---------------------------------------------------------------- 初始化式

    // Initializer → AssignExp | InitializerList
    private ASTNode Initializer() {
        if (check(TokenType.LBRACE)) {
            return InitializerList();
        }
        return AssignExp();
    }

    // InitializerList → '{' [InitializerItem { ',' InitializerItem } [',']] '}'
    private ASTNode InitializerList() {
        Coord start = coord();
        expect(TokenType.LBRACE, "'{'");
        List<ASTNode> items = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            items.add(InitializerItem());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(TokenType.RBRACE, "'}'");
        return initList(items, start);
    }

    // InitializerItem → [Designator { Designator } '='] Initializer
    // Designator → '[' ConstantExp ']' | '.' Ident
    private ASTNode InitializerItem() {
        if (!check(TokenType.PERIOD) && !check(TokenType.LBRACK)) {
            return Initializer();
        }
        Coord start = coord();
        List<ASTNode> designators = new ArrayList<>();
        StringBuilder designation = new StringBuilder();
        while (true) {
            if (match(TokenType.PERIOD)) {
                Token field = expectName("field name");
                designators.add(id(field.value, field.getCoord()));
                designation.append('.').append(field.value);
            } else if (match(TokenType.LBRACK)) {
                ASTNode index = ConstantExp();
                expect(TokenType.RBRACK, "']'");
                Long value = folder.evaluate(index);
                designators.add(index);
                designation.append('[').append(value == null ? "?" : value.toString()).append(']');
            } else {
                break;
            }
        }
        expect(TokenType.ASSIGN, "'='");
        return namedInitializer(designation.toString(), designators, Initializer(), start);
    }

    // ---------------------------------------------------------------- 语句

    // CompoundStmt → '{' { BlockItem } '}'
    // openScope 为 false 时作用域由调用者（函数定义）打开，这里同样负责弹出
    private ASTNode CompoundStmt(boolean openScope) {
        Coord start = coord();
        expect(TokenType.LBRACE, "'{'");
        if (openScope) {
            scopes.pushScope();
        }
        List<ASTNode> items = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (check(TokenType.EOF)) {
                throw error("expected '}'");
            }
            BlockItem(items);
        }
        scopes.popScope(); // 在吃掉 '}' 之前退出作用域
        nextToken();
        return compound(items, start);
    }

    // BlockItem → Declaration | Stmt
    private void BlockItem(List<ASTNode> items) {
        if (isDeclSpecStart(currentToken)) {
            items.addAll(Declaration());
        } else {
            items.add(Stmt());
        }
    }

    private ASTNode Stmt() {
        Coord start = coord();
        switch (currentToken.type) {
            case LBRACE:
                return CompoundStmt(true);
            case IFTK:
                return IfStmt();
            case SWITCHTK:
                return SwitchStmt();
            case WHILETK:
                return WhileStmt();
            case DOTK:
                return DoWhileStmt();
            case FORTK:
                return ForStmt();
            case GOTOTK: {
                nextToken();
                Token target = expectName("label name");
                expect(TokenType.SEMICN, "';'");
                return gotoStmt(target.value, start);
            }
            case CONTINUETK:
                nextToken();
                expect(TokenType.SEMICN, "';'");
                return continueStmt(start);
            case BREAKTK:
                nextToken();
                expect(TokenType.SEMICN, "';'");
                return breakStmt(start);
            case RETURNTK: {
                nextToken();
                ASTNode value = check(TokenType.SEMICN) ? null : Expression();
                expect(TokenType.SEMICN, "';'");
                return returnStmt(value, start);
            }
            case CASETK: {
                nextToken();
                ASTNode value = ConstantExp();
                expect(TokenType.COLON, "':'");
                return caseStmt(value, Stmt(), start);
            }
            case DEFAULTTK:
                nextToken();
                expect(TokenType.COLON, "':'");
                return defaultStmt(Stmt(), start);
            case SEMICN:
                nextToken();
                return emptyStatement(start);
            case PRAGMA:
                return Pragma();
            case IDENFR:
                if (peek().type == TokenType.COLON) {
                    // LabeledStmt → Ident ':' Stmt
                    String name = currentToken.value;
                    nextToken();
                    nextToken();
                    return label(name, Stmt(), start);
                }
                break;
            default:
                break;
        }
        // ExpStmt → Expression ';'
        ASTNode expr = Expression();
        expect(TokenType.SEMICN, "';'");
        return expr;
    }

    // IfStmt → 'if' '(' Expression ')' Stmt ['else' Stmt]，else 跟最近的 if 结合
    private ASTNode IfStmt() {
        Coord start = coord();
        nextToken();
        expect(TokenType.LPARENT, "'('");
        ASTNode cond = Expression();
        expect(TokenType.RPARENT, "')'");
        ASTNode then = Stmt();
        ASTNode otherwise = null;
        if (match(TokenType.ELSETK)) {
            otherwise = Stmt();
        }
        return ifStmt(cond, then, otherwise, start);
    }

    // SwitchStmt → 'switch' '(' Expression ')' Stmt
    private ASTNode SwitchStmt() {
        Coord start = coord();
        nextToken();
        expect(TokenType.LPARENT, "'('");
        ASTNode cond = Expression();
        expect(TokenType.RPARENT, "')'");
        return switchStmt(cond, Stmt(), start);
    }

    // WhileStmt → 'while' '(' Expression ')' Stmt
    private ASTNode WhileStmt() {
        Coord start = coord();
        nextToken();
        expect(TokenType.LPARENT, "'('");
        ASTNode cond = Expression();
        expect(TokenType.RPARENT, "')'");
        return whileStmt(cond, Stmt(), start);
    }

    // DoWhileStmt → 'do' Stmt 'while' '(' Expression ')' ';'
    private ASTNode DoWhileStmt() {
        Coord start = coord();
        nextToken();
        ASTNode body = Stmt();
        expect(TokenType.WHILETK, "'while'");
        expect(TokenType.LPARENT, "'('");
        ASTNode cond = Expression();
        expect(TokenType.RPARENT, "')'");
        expect(TokenType.SEMICN, "';'");
        return doWhile(body, cond, start);
    }

    // ForStmt → 'for' '(' (Declaration | [Expression] ';') [Expression] ';' [Expression] ')' Stmt
    private ASTNode ForStmt() {
        Coord start = coord();
        nextToken();
        expect(TokenType.LPARENT, "'('");
        scopes.pushScope(); // for 的声明子句有自己的作用域
        ASTNode init = null;
        if (isDeclSpecStart(currentToken)) {
            Coord declCoord = coord();
            init = declList(Declaration(), declCoord);
        } else {
            if (!check(TokenType.SEMICN)) {
                init = Expression();
            }
            expect(TokenType.SEMICN, "';'");
        }
        ASTNode cond = check(TokenType.SEMICN) ? null : Expression();
        expect(TokenType.SEMICN, "';'");
        ASTNode next = check(TokenType.RPARENT) ? null : Expression();
        expect(TokenType.RPARENT, "')'");
        ASTNode body = Stmt();
        scopes.popScope();
        // 循环体后面的 token 已经在 for 作用域里读出，要按外层作用域重新判断
        refreshLookahead();
        return forStmt(init, cond, next, body, start);
    }

    private ASTNode Pragma() {
        Token token = expect(TokenType.PRAGMA, "#pragma");
        return pragma(token.value, token.getCoord());
    }

    // ---------------------------------------------------------------- 表达式

    // Expression → AssignExp { ',' AssignExp }
    private ASTNode Expression() {
        ASTNode first = AssignExp();
        if (!check(TokenType.COMMA)) {
            return first;
        }
        List<ASTNode> exprs = new ArrayList<>();
        exprs.add(first);
        while (match(TokenType.COMMA)) {
            exprs.add(AssignExp());
        }
        return exprList(exprs, first.getCoord());
    }

    // AssignExp → CondExp | UnaryExp AssignOp AssignExp（右结合）
    private ASTNode AssignExp() {
        ASTNode left = CondExp();
        if (isAssignOp(currentToken.type)) {
            Token op = currentToken;
            if (left.is(NodeKind.BINARY_OP) || left.is(NodeKind.TERNARY_OP) || left.is(NodeKind.CAST)) {
                throw new SyntaxError("expression is not assignable", op);
            }
            nextToken();
            ASTNode right = AssignExp();
            return assignment(op.value, left, right, left.getCoord());
        }
        return left;
    }

    private boolean isAssignOp(TokenType type) {
        switch (type) {
            case ASSIGN:
            case MULTEQ:
            case DIVEQ:
            case MODEQ:
            case PLUSEQ:
            case MINUEQ:
            case SHLEQ:
            case SHREQ:
            case ANDEQ:
            case XOREQ:
            case OREQ:
                return true;
            default:
                return false;
        }
    }

    // ConstantExp → CondExp
    private ASTNode ConstantExp() {
        return CondExp();
    }

    // CondExp → BinaryExp ['?' Expression ':' CondExp]
    private ASTNode CondExp() {
        ASTNode cond = BinaryExp(1);
        if (match(TokenType.QUESTION)) {
            ASTNode ifTrue = Expression();
            expect(TokenType.COLON, "':'");
            ASTNode ifFalse = CondExp();
            return ternaryOp(cond, ifTrue, ifFalse, cond.getCoord());
        }
        return cond;
    }

    // 二元运算符的优先级爬升，全部左结合：|| < && < | < ^ < & < 相等 < 关系 < 移位 < 加减 < 乘除模
    private ASTNode BinaryExp(int minPrecedence) {
        ASTNode left = CastExp();
        while (true) {
            int precedence = binaryPrecedence(currentToken.type);
            if (precedence < minPrecedence) {
                return left;
            }
            Token op = currentToken;
            nextToken();
            ASTNode right = BinaryExp(precedence + 1);
            left = binaryOp(op.value, left, right, left.getCoord());
        }
    }

    private static int binaryPrecedence(TokenType type) {
        switch (type) {
            case OR:
                return 1;
            case AND:
                return 2;
            case BITOR:
                return 3;
            case XOR:
                return 4;
            case BITAND:
                return 5;
            case EQL:
            case NEQ:
                return 6;
            case LSS:
            case LEQ:
            case GRE:
            case GEQ:
                return 7;
            case SHL:
            case SHR:
                return 8;
            case PLUS:
            case MINU:
                return 9;
            case MULT:
            case DIV:
            case MOD:
                return 10;
            default:
                return 0;
        }
    }

    // CastExp → '(' TypeName ')' CastExp | '(' TypeName ')' InitializerList | UnaryExp
    private ASTNode CastExp() {
        if (check(TokenType.LPARENT) && isTypeNameStart(peek())) {
            Coord start = coord();
            nextToken();
            ASTNode type = TypeName();
            expect(TokenType.RPARENT, "')'");
            if (check(TokenType.LBRACE)) {
                return PostfixTail(compoundLiteral(type, InitializerList(), start));
            }
            return cast(type, CastExp(), start);
        }
        return UnaryExp();
    }

    // UnaryExp → PostfixExp | ('++' | '--') UnaryExp | UnaryOp CastExp | 'sizeof' UnaryExp | 'sizeof' '(' TypeName ')'
    private ASTNode UnaryExp() {
        Token op = currentToken;
        switch (op.type) {
            case INC:
            case DEC:
                nextToken();
                return unaryOp(op.value, UnaryExp(), op.getCoord());
            case BITAND:
            case MULT:
            case PLUS:
            case MINU:
            case BITNOT:
            case NOT:
                nextToken();
                return unaryOp(op.value, CastExp(), op.getCoord());
            case SIZEOFTK:
                nextToken();
                if (check(TokenType.LPARENT) && isTypeNameStart(peek())) {
                    Coord paren = coord();
                    nextToken();
                    ASTNode type = TypeName();
                    expect(TokenType.RPARENT, "')'");
                    if (check(TokenType.LBRACE)) {
                        ASTNode literal = PostfixTail(compoundLiteral(type, InitializerList(), paren));
                        return unaryOp(op.value, literal, op.getCoord());
                    }
                    return unaryOp(op.value, type, op.getCoord());
                }
                return unaryOp(op.value, UnaryExp(), op.getCoord());
            default:
                return PostfixTail(PrimaryExp());
        }
    }

    // PostfixExp → PrimaryExp { '[' Expression ']' | '(' [ArgList] ')' | ('.' | '->') Ident | '++' | '--' }
    private ASTNode PostfixTail(ASTNode expr) {
        while (true) {
            Token op = currentToken;
            switch (op.type) {
                case LBRACK: {
                    nextToken();
                    ASTNode subscript = Expression();
                    expect(TokenType.RBRACK, "']'");
                    expr = arrayRef(expr, subscript, expr.getCoord());
                    break;
                }
                case LPARENT: {
                    nextToken();
                    ASTNode args = null;
                    if (!check(TokenType.RPARENT)) {
                        List<ASTNode> list = new ArrayList<>();
                        do {
                            list.add(AssignExp());
                        } while (match(TokenType.COMMA));
                        args = exprList(list, list.get(0).getCoord());
                    }
                    expect(TokenType.RPARENT, "')'");
                    expr = funcCall(expr, args, expr.getCoord());
                    break;
                }
                case PERIOD:
                case ARROW: {
                    nextToken();
                    Token field = expectName("member name");
                    expr = structRef(expr, op.value, id(field.value, field.getCoord()), expr.getCoord());
                    break;
                }
                case INC:
                case DEC:
                    nextToken();
                    expr = unaryOp("p" + op.value, expr, expr.getCoord());
                    break;
                default:
                    return expr;
            }
        }
    }

    // PrimaryExp → Ident | Constant | StringLiteral { StringLiteral } | '(' Expression ')'
    private ASTNode PrimaryExp() {
        Token token = currentToken;
        switch (token.type) {
            case IDENFR:
                nextToken();
                return id(token.value, token.getCoord());
            case INTCON:
                nextToken();
                return constant("int", token.value, token.getCoord());
            case FLOATCON:
                nextToken();
                return constant("float", token.value, token.getCoord());
            case CHRCON:
                nextToken();
                return constant("char", token.value, token.getCoord());
            case STRCON: {
                // 相邻的字符串常量拼接成一个，任意一段带 L 前缀则结果为宽字符串
                boolean wide = false;
                StringBuilder body = new StringBuilder();
                while (check(TokenType.STRCON)) {
                    String piece = currentToken.value;
                    int quote = piece.indexOf('"');
                    wide |= quote > 0;
                    body.append(piece, quote + 1, piece.length() - 1);
                    nextToken();
                }
                String value = (wide ? "L\"" : "\"") + body + "\"";
                return constant("string", value, token.getCoord());
            }
            case LPARENT: {
                nextToken();
                ASTNode expr = Expression();
                expect(TokenType.RPARENT, "')'");
                return expr;
            }
            case OFFSETOFTK: {
                // offsetof '(' TypeName ',' OffsetofDesignator ')'，按函数调用建树
                nextToken();
                expect(TokenType.LPARENT, "'('");
                List<ASTNode> args = new ArrayList<>();
                args.add(TypeName());
                expect(TokenType.COMMA, "','");
                args.add(OffsetofDesignator());
                expect(TokenType.RPARENT, "')'");
                return funcCall(id(token.value, token.getCoord()), exprList(args, token.getCoord()), token.getCoord());
            }
            case TYPEID:
                throw error("unexpected type name '" + token.value + "'");
            default:
                throw error("expected expression");
        }
    }

    // OffsetofDesignator → Ident { '.' Ident | '[' Expression ']' }
    private ASTNode OffsetofDesignator() {
        Token name = expectName("member name");
        ASTNode designator = id(name.value, name.getCoord());
        while (true) {
            if (match(TokenType.PERIOD)) {
                Token field = expectName("member name");
                designator = structRef(designator, ".", id(field.value, field.getCoord()), designator.getCoord());
            } else if (match(TokenType.LBRACK)) {
                ASTNode index = Expression();
                expect(TokenType.RBRACK, "']'");
                designator = arrayRef(designator, index, designator.getCoord());
            } else {
                return designator;
            }
        }
    }

    // ---------------------------------------------------------------- 辅助结构

    // 声明说明符：存储类、限定符、函数说明符、类型说明符
    private static final class DeclSpec {
        final Coord coord;
        final List<String> storage = new ArrayList<>();
        final List<String> quals = new ArrayList<>();
        final List<String> funcspec = new ArrayList<>();
        final List<String> typeNames = new ArrayList<>();
        boolean typedefName; // 类型来自 typedef 名
        ASTNode tag; // struct/union/enum 说明符
        String tagType;

        DeclSpec(Coord coord) {
            this.coord = coord;
        }

        void setTag(ASTNode node) {
            tag = node;
            String keyword = node.getKind() == NodeKind.STRUCT ? "struct"
                    : node.getKind() == NodeKind.UNION ? "union" : "enum";
            tagType = node.getName() == null ? keyword : keyword + " " + node.getName();
        }

        boolean hasType() {
            return !typeNames.isEmpty() || tagType != null;
        }

        boolean isEmpty() {
            return !hasType() && storage.isEmpty() && quals.isEmpty() && funcspec.isEmpty();
        }

        boolean isTypedef() {
            return storage.contains("typedef");
        }

        String type() {
            return tagType != null ? tagType : String.join(" ", typeNames);
        }

        String storage() {
            return String.join(" ", storage);
        }

        String quals() {
            return String.join(" ", quals);
        }

        String funcspec() {
            return String.join(" ", funcspec);
        }
    }

    // 声明符：名字（抽象声明符为 null）和从名字向外的类型派生
    private static final class Declarator {
        final Token nameToken;
        final Coord coord;
        final List<Derivation> derivations = new ArrayList<>();

        Declarator(Token nameToken, Coord coord) {
            this.nameToken = nameToken;
            this.coord = coord;
        }

        String name() {
            return nameToken == null ? null : nameToken.value;
        }

        boolean isFunction() {
            return !derivations.isEmpty() && derivations.get(0).kind == NodeKind.FUNC_DECL;
        }
    }

    // 一层类型派生：指针、数组或函数
    private static final class Derivation {
        final NodeKind kind;
        final String quals;
        final ASTNode dim;
        final ASTNode params;
        final List<Token> paramNames;
        final Coord coord;

        private Derivation(NodeKind kind, String quals, ASTNode dim, ASTNode params, List<Token> paramNames, Coord coord) {
            this.kind = kind;
            this.quals = quals;
            this.dim = dim;
            this.params = params;
            this.paramNames = paramNames;
            this.coord = coord;
        }

        static Derivation pointer(String quals, Coord coord) {
            return new Derivation(NodeKind.PTR_DECL, quals, null, null, new ArrayList<>(), coord);
        }

        static Derivation array(String quals, ASTNode dim, Coord coord) {
            return new Derivation(NodeKind.ARRAY_DECL, quals, dim, null, new ArrayList<>(), coord);
        }

        static Derivation function(ASTNode params, List<Token> paramNames, Coord coord) {
            return new Derivation(NodeKind.FUNC_DECL, null, null, params, paramNames, coord);
        }
    }
}

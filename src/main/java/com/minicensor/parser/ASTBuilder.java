package com.minicensor.parser;

import com.minicensor.censor.WildcardRegistry;
import com.minicensor.parser.clauses.AliasedSelectItem;
import com.minicensor.parser.clauses.AliasedTableExpression;
import com.minicensor.parser.clauses.Assignment;
import com.minicensor.parser.clauses.ConvertType;
import com.minicensor.parser.clauses.Identifier;
import com.minicensor.parser.clauses.IndexHints;
import com.minicensor.parser.clauses.JoinCondition;
import com.minicensor.parser.clauses.JoinTableExpression;
import com.minicensor.parser.clauses.Limit;
import com.minicensor.parser.clauses.LockMode;
import com.minicensor.parser.clauses.NextvalSelectItem;
import com.minicensor.parser.clauses.OrderByItem;
import com.minicensor.parser.clauses.ParenTableExpression;
import com.minicensor.parser.clauses.SelectItem;
import com.minicensor.parser.clauses.StarSelectItem;
import com.minicensor.parser.clauses.TableExpression;
import com.minicensor.parser.clauses.TableName;
import com.minicensor.parser.clauses.WhenClause;
import com.minicensor.parser.clauses.WhereClause;
import com.minicensor.parser.expressions.*;
import com.minicensor.parser.statements.*;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ASTBuilder - 将ANTLR语法树转换为Statement对象
 *
 * 使用访问者模式遍历ANTLR生成的语法树,将其转换为强类型、不可变的AST。
 *
 * 设计原则:
 * - "Good taste": 每个visit方法只做一件事,清晰明了
 * - 通配符记号统一从WildcardRegistry取哨兵,解析器不自己构造哨兵
 * - 消除特殊情况: 负数字面量折叠为字面量,INSERT ... SET 改写为列列表加单行VALUES,
 *   括号包裹的 %%SUBQUERY%% 与裸写的 %%SUBQUERY%% 生成相同结构
 *
 * 注释处理:
 * - 块注释在HIDDEN通道,只收集紧跟在语句关键字之后的注释
 *
 * 错误处理:
 * - 遇到无法识别的运算符或字面量,抛出ParseException
 */
public class ASTBuilder extends MySQLBaseVisitor<Object> {

    /** 用于读取HIDDEN通道中的注释 */
    private final CommonTokenStream tokens;

    private final WildcardRegistry wildcards;

    public ASTBuilder(CommonTokenStream tokens, WildcardRegistry wildcards) {
        this.tokens = tokens;
        this.wildcards = wildcards;
    }

    @Override
    public Statement visitSqlStatement(MySQLParser.SqlStatementContext ctx) {
        return (Statement) visit(ctx.statement());
    }

    @Override
    public Statement visitStatement(MySQLParser.StatementContext ctx) {
        return (Statement) visit(ctx.getChild(0));
    }

    @Override
    public Statement visitStatementWildcard(MySQLParser.StatementWildcardContext ctx) {
        return wildcards.statementSentinel(Wildcard.fromToken(ctx.getText()));
    }

    // ==================== SELECT / UNION ====================

    @Override
    public QueryStatement visitSimpleSelect(MySQLParser.SimpleSelectContext ctx) {
        return buildSelect(ctx.baseSelect(),
                orderBy(ctx.orderByClause()),
                limit(ctx.limitClause()),
                lock(ctx.lockClause()));
    }

    @Override
    public QueryStatement visitParenSelect(MySQLParser.ParenSelectContext ctx) {
        return new ParenSelectStatement((QueryStatement) visit(ctx.selectStatement()));
    }

    @Override
    public QueryStatement visitUnionSelect(MySQLParser.UnionSelectContext ctx) {
        // 左结合: a UNION b UNION c => Union(Union(a, b), c)
        List<UnionStatement.UnionType> unionTypes = new ArrayList<>();
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof TerminalNode
                    && ((TerminalNode) child).getSymbol().getType() == MySQLParser.UNION) {
                unionTypes.add(unionType(ctx.getChild(i + 1)));
            }
        }

        List<MySQLParser.UnionOperandContext> operands = ctx.unionOperand();
        QueryStatement result = (QueryStatement) visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            QueryStatement right = (QueryStatement) visit(operands.get(i));
            boolean last = i == operands.size() - 1;
            result = new UnionStatement(unionTypes.get(i - 1), result, right,
                    last ? orderBy(ctx.orderByClause()) : null,
                    last ? limit(ctx.limitClause()) : null,
                    last ? lock(ctx.lockClause()) : null);
        }
        return result;
    }

    private UnionStatement.UnionType unionType(ParseTree afterUnion) {
        if (afterUnion instanceof TerminalNode) {
            int type = ((TerminalNode) afterUnion).getSymbol().getType();
            if (type == MySQLParser.ALL) {
                return UnionStatement.UnionType.UNION_ALL;
            }
            if (type == MySQLParser.DISTINCT) {
                return UnionStatement.UnionType.UNION_DISTINCT;
            }
        }
        return UnionStatement.UnionType.UNION;
    }

    @Override
    public QueryStatement visitUnionOperand(MySQLParser.UnionOperandContext ctx) {
        if (ctx.baseSelect() != null) {
            return buildSelect(ctx.baseSelect(), null, null, null);
        }
        if (ctx.SUBQUERY_WILDCARD() != null) {
            return wildcards.subquerySentinel();
        }
        if (ctx.SELECT_WILDCARD() != null) {
            Statement sentinel = wildcards.statementSentinel(Wildcard.SELECT);
            if (!(sentinel instanceof QueryStatement)) {
                throw new ParseException("%%SELECT%% cannot be used as a UNION operand with this registry");
            }
            return (QueryStatement) sentinel;
        }
        return new ParenSelectStatement((QueryStatement) visit(ctx.selectStatement()));
    }

    private SelectStatement buildSelect(MySQLParser.BaseSelectContext ctx,
                                        List<OrderByItem> orderBy,
                                        Limit limit,
                                        LockMode lock) {
        String cache = ctx.cacheOption != null ? ctx.cacheOption.getText().toLowerCase(Locale.ROOT) : null;
        boolean distinct = ctx.distinctOption != null && ctx.distinctOption.getType() == MySQLParser.DISTINCT;
        String hints = ctx.STRAIGHT_JOIN() != null ? "straight_join" : null;

        List<TableExpression> from = ctx.fromClause() != null
                ? tableExpressions(ctx.fromClause().tableReferences())
                : List.of();

        WhereClause where = ctx.whereClause() != null ? visitWhereClause(ctx.whereClause()) : null;

        List<Expression> groupBy = new ArrayList<>();
        if (ctx.groupByClause() != null) {
            for (MySQLParser.ExpressionContext exprCtx : ctx.groupByClause().expression()) {
                groupBy.add(expression(exprCtx));
            }
        }

        WhereClause having = ctx.havingClause() != null ? visitHavingClause(ctx.havingClause()) : null;

        return new SelectStatement(comments(ctx.SELECT().getSymbol()), cache, distinct, hints,
                visitSelectItemList(ctx.selectItemList()), from, where, groupBy, having,
                orderBy, limit, lock);
    }

    @Override
    public List<SelectItem> visitSelectItemList(MySQLParser.SelectItemListContext ctx) {
        List<SelectItem> items = new ArrayList<>();
        for (MySQLParser.SelectItemContext itemCtx : ctx.selectItem()) {
            items.add((SelectItem) visit(itemCtx));
        }
        return items;
    }

    @Override
    public SelectItem visitStarSelectItem(MySQLParser.StarSelectItemContext ctx) {
        return new StarSelectItem(null);
    }

    @Override
    public SelectItem visitTableStarSelectItem(MySQLParser.TableStarSelectItemContext ctx) {
        return new StarSelectItem(new TableName(null, visitIdentifier(ctx.identifier())));
    }

    @Override
    public SelectItem visitSchemaTableStarSelectItem(MySQLParser.SchemaTableStarSelectItemContext ctx) {
        return new StarSelectItem(new TableName(visitIdentifier(ctx.identifier(0)), visitIdentifier(ctx.identifier(1))));
    }

    @Override
    public SelectItem visitNextvalSelectItem(MySQLParser.NextvalSelectItemContext ctx) {
        return new NextvalSelectItem(expression(ctx.expression()));
    }

    @Override
    public SelectItem visitExpressionSelectItem(MySQLParser.ExpressionSelectItemContext ctx) {
        Identifier alias = null;
        if (ctx.alias() != null) {
            alias = ctx.alias().identifier() != null
                    ? visitIdentifier(ctx.alias().identifier())
                    : Identifier.of(unquote(ctx.alias().STRING_LITERAL().getText()));
        }
        return new AliasedSelectItem(expression(ctx.expression()), alias);
    }

    @Override
    public WhereClause visitWhereClause(MySQLParser.WhereClauseContext ctx) {
        if (ctx.WHERE_WILDCARD() != null) {
            return wildcards.whereSentinel();
        }
        return new WhereClause(WhereClause.ClauseType.WHERE, expression(ctx.expression()));
    }

    @Override
    public WhereClause visitHavingClause(MySQLParser.HavingClauseContext ctx) {
        if (ctx.WHERE_WILDCARD() != null) {
            return wildcards.havingSentinel();
        }
        return new WhereClause(WhereClause.ClauseType.HAVING, expression(ctx.expression()));
    }

    private List<OrderByItem> orderBy(MySQLParser.OrderByClauseContext ctx) {
        List<OrderByItem> items = new ArrayList<>();
        if (ctx == null) {
            return items;
        }
        for (MySQLParser.OrderItemContext itemCtx : ctx.orderItem()) {
            OrderByItem.Direction direction = itemCtx.direction != null
                    && itemCtx.direction.getType() == MySQLParser.DESC
                    ? OrderByItem.Direction.DESC
                    : OrderByItem.Direction.ASC;
            items.add(new OrderByItem(expression(itemCtx.expression()), direction));
        }
        return items;
    }

    private Limit limit(MySQLParser.LimitClauseContext ctx) {
        return ctx != null ? (Limit) visit(ctx) : null;
    }

    @Override
    public Limit visitRowCountLimit(MySQLParser.RowCountLimitContext ctx) {
        return new Limit(null, expression(ctx.rowCount));
    }

    @Override
    public Limit visitOffsetCommaLimit(MySQLParser.OffsetCommaLimitContext ctx) {
        return new Limit(expression(ctx.offset), expression(ctx.rowCount));
    }

    @Override
    public Limit visitOffsetKeywordLimit(MySQLParser.OffsetKeywordLimitContext ctx) {
        return new Limit(expression(ctx.offset), expression(ctx.rowCount));
    }

    private LockMode lock(MySQLParser.LockClauseContext ctx) {
        if (ctx == null) {
            return LockMode.NONE;
        }
        return ctx instanceof MySQLParser.ForUpdateLockContext ? LockMode.FOR_UPDATE : LockMode.SHARE_MODE;
    }

    // ==================== 表引用 ====================

    private List<TableExpression> tableExpressions(MySQLParser.TableReferencesContext ctx) {
        List<TableExpression> tables = new ArrayList<>();
        for (MySQLParser.TableReferenceContext refCtx : ctx.tableReference()) {
            tables.add((TableExpression) visit(refCtx));
        }
        return tables;
    }

    @Override
    public TableExpression visitJoinedTable(MySQLParser.JoinedTableContext ctx) {
        TableExpression left = (TableExpression) visit(ctx.tableReference());
        JoinTableExpression.JoinType joinType = (JoinTableExpression.JoinType) visit(ctx.joinOperator());
        TableExpression right = (TableExpression) visit(ctx.tableFactor());
        JoinCondition condition = ctx.joinCondition() != null
                ? (JoinCondition) visit(ctx.joinCondition())
                : JoinCondition.NONE;
        return new JoinTableExpression(left, joinType, right, condition);
    }

    @Override
    public TableExpression visitFactorTable(MySQLParser.FactorTableContext ctx) {
        return (TableExpression) visit(ctx.tableFactor());
    }

    @Override
    public Object visitInnerJoin(MySQLParser.InnerJoinContext ctx) {
        return JoinTableExpression.JoinType.JOIN;
    }

    @Override
    public Object visitStraightJoin(MySQLParser.StraightJoinContext ctx) {
        return JoinTableExpression.JoinType.STRAIGHT_JOIN;
    }

    @Override
    public Object visitLeftJoin(MySQLParser.LeftJoinContext ctx) {
        return JoinTableExpression.JoinType.LEFT_JOIN;
    }

    @Override
    public Object visitRightJoin(MySQLParser.RightJoinContext ctx) {
        return JoinTableExpression.JoinType.RIGHT_JOIN;
    }

    @Override
    public Object visitNaturalJoin(MySQLParser.NaturalJoinContext ctx) {
        return JoinTableExpression.JoinType.NATURAL_JOIN;
    }

    @Override
    public Object visitNaturalLeftJoin(MySQLParser.NaturalLeftJoinContext ctx) {
        return JoinTableExpression.JoinType.NATURAL_LEFT_JOIN;
    }

    @Override
    public Object visitNaturalRightJoin(MySQLParser.NaturalRightJoinContext ctx) {
        return JoinTableExpression.JoinType.NATURAL_RIGHT_JOIN;
    }

    @Override
    public JoinCondition visitOnCondition(MySQLParser.OnConditionContext ctx) {
        return JoinCondition.on(expression(ctx.expression()));
    }

    @Override
    public JoinCondition visitUsingCondition(MySQLParser.UsingConditionContext ctx) {
        return JoinCondition.using(columnIdentifiers(ctx.columnIdentifier()));
    }

    @Override
    public TableExpression visitTableNameFactor(MySQLParser.TableNameFactorContext ctx) {
        List<Identifier> partitions = ctx.partitionClause() != null
                ? columnIdentifiers(ctx.partitionClause().columnIdentifier())
                : null;
        IndexHints hints = null;
        if (ctx.indexHint() != null) {
            IndexHints.HintType hintType = IndexHints.HintType.valueOf(
                    ctx.indexHint().hintType.getText().toUpperCase(Locale.ROOT));
            hints = new IndexHints(hintType, columnIdentifiers(ctx.indexHint().columnIdentifier()));
        }
        return AliasedTableExpression.ofTable(visitTableName(ctx.tableName()), partitions,
                tableAlias(ctx.tableAlias), hints);
    }

    @Override
    public TableExpression visitDerivedTableFactor(MySQLParser.DerivedTableFactorContext ctx) {
        SubqueryExpression subquery = new SubqueryExpression((QueryStatement) visit(ctx.selectStatement()));
        return AliasedTableExpression.ofSubquery(subquery, tableAlias(ctx.tableAlias));
    }

    @Override
    public TableExpression visitParenSubqueryWildcardFactor(MySQLParser.ParenSubqueryWildcardFactorContext ctx) {
        return AliasedTableExpression.ofSubquery(subqueryWildcard(), tableAlias(ctx.tableAlias));
    }

    @Override
    public TableExpression visitSubqueryWildcardFactor(MySQLParser.SubqueryWildcardFactorContext ctx) {
        return AliasedTableExpression.ofSubquery(subqueryWildcard(), tableAlias(ctx.tableAlias));
    }

    @Override
    public TableExpression visitParenTableFactor(MySQLParser.ParenTableFactorContext ctx) {
        return new ParenTableExpression(tableExpressions(ctx.tableReferences()));
    }

    private Identifier tableAlias(MySQLParser.IdentifierContext ctx) {
        return ctx != null ? visitIdentifier(ctx) : null;
    }

    @Override
    public TableName visitTableName(MySQLParser.TableNameContext ctx) {
        if (ctx.name != null) {
            return new TableName(visitIdentifier(ctx.qualifier), visitIdentifier(ctx.name));
        }
        return new TableName(null, visitIdentifier(ctx.identifier(0)));
    }

    // ==================== INSERT ====================

    @Override
    public InsertStatement visitValuesInsert(MySQLParser.ValuesInsertContext ctx) {
        List<ValueTupleExpression> rows = new ArrayList<>();
        QueryStatement source = null;
        MySQLParser.InsertSourceContext sourceCtx = ctx.insertSource();
        if (sourceCtx instanceof MySQLParser.ValuesSourceContext) {
            for (MySQLParser.ValueRowContext rowCtx : ((MySQLParser.ValuesSourceContext) sourceCtx).valueRow()) {
                rows.add(new ValueTupleExpression(expressions(rowCtx.expression())));
            }
        } else {
            source = (QueryStatement) visit(((MySQLParser.SelectSourceContext) sourceCtx).selectStatement());
        }

        return new InsertStatement(insertAction(ctx.action), comments(ctx.action), ctx.IGNORE() != null,
                visitTableName(ctx.tableName()), partitions(ctx.partitionClause()),
                columnIdentifiers(ctx.columnIdentifier()), rows, source, onDuplicate(ctx.onDuplicateClause()));
    }

    @Override
    public InsertStatement visitSetInsert(MySQLParser.SetInsertContext ctx) {
        // INSERT ... SET a = 1, b = 2 等价于 INSERT ... (a, b) VALUES (1, 2)
        List<Identifier> columns = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        for (MySQLParser.AssignmentContext assignmentCtx : ctx.assignment()) {
            Assignment assignment = visitAssignment(assignmentCtx);
            columns.add(assignment.getColumn().getName());
            values.add(assignment.getValue());
        }

        return new InsertStatement(insertAction(ctx.action), comments(ctx.action), ctx.IGNORE() != null,
                visitTableName(ctx.tableName()), partitions(ctx.partitionClause()),
                columns, List.of(new ValueTupleExpression(values)), null, onDuplicate(ctx.onDuplicateClause()));
    }

    private InsertStatement.Action insertAction(Token action) {
        return action.getType() == MySQLParser.REPLACE ? InsertStatement.Action.REPLACE : InsertStatement.Action.INSERT;
    }

    private List<Assignment> onDuplicate(MySQLParser.OnDuplicateClauseContext ctx) {
        return ctx != null ? assignments(ctx.assignment()) : List.of();
    }

    @Override
    public Assignment visitAssignment(MySQLParser.AssignmentContext ctx) {
        return new Assignment(visitColumnRef(ctx.columnRef()), expression(ctx.expression()));
    }

    private List<Assignment> assignments(List<MySQLParser.AssignmentContext> contexts) {
        List<Assignment> assignments = new ArrayList<>();
        for (MySQLParser.AssignmentContext assignmentCtx : contexts) {
            assignments.add(visitAssignment(assignmentCtx));
        }
        return assignments;
    }

    private List<Identifier> partitions(MySQLParser.PartitionClauseContext ctx) {
        return ctx != null ? columnIdentifiers(ctx.columnIdentifier()) : List.of();
    }

    // ==================== UPDATE / DELETE ====================

    @Override
    public UpdateStatement visitUpdateStatement(MySQLParser.UpdateStatementContext ctx) {
        WhereClause where = ctx.whereClause() != null ? visitWhereClause(ctx.whereClause()) : null;
        return new UpdateStatement(comments(ctx.UPDATE().getSymbol()),
                tableExpressions(ctx.tableReferences()),
                assignments(ctx.assignment()),
                where,
                orderBy(ctx.orderByClause()),
                limit(ctx.limitClause()));
    }

    @Override
    public DeleteStatement visitSingleTableDelete(MySQLParser.SingleTableDeleteContext ctx) {
        TableExpression table = AliasedTableExpression.ofTable(visitTableName(ctx.tableName()), null, null, null);
        WhereClause where = ctx.whereClause() != null ? visitWhereClause(ctx.whereClause()) : null;
        return new DeleteStatement(comments(ctx.DELETE().getSymbol()), null, List.of(table),
                partitions(ctx.partitionClause()), where, orderBy(ctx.orderByClause()), limit(ctx.limitClause()));
    }

    @Override
    public DeleteStatement visitMultiTableDelete(MySQLParser.MultiTableDeleteContext ctx) {
        WhereClause where = ctx.whereClause() != null ? visitWhereClause(ctx.whereClause()) : null;
        return new DeleteStatement(comments(ctx.DELETE().getSymbol()), tableNames(ctx.tableName()),
                tableExpressions(ctx.tableReferences()), null, where, null, null);
    }

    @Override
    public DeleteStatement visitMultiTableUsingDelete(MySQLParser.MultiTableUsingDeleteContext ctx) {
        WhereClause where = ctx.whereClause() != null ? visitWhereClause(ctx.whereClause()) : null;
        return new DeleteStatement(comments(ctx.DELETE().getSymbol()), tableNames(ctx.tableName()),
                tableExpressions(ctx.tableReferences()), null, where, null, null);
    }

    private List<TableName> tableNames(List<MySQLParser.TableNameContext> contexts) {
        List<TableName> names = new ArrayList<>();
        for (MySQLParser.TableNameContext nameCtx : contexts) {
            names.add(visitTableName(nameCtx));
        }
        return names;
    }

    // ==================== 其他语句 ====================

    @Override
    public SetStatement visitSetStatement(MySQLParser.SetStatementContext ctx) {
        String scope = ctx.scope != null ? ctx.scope.getText().toLowerCase(Locale.ROOT) : null;
        return new SetStatement(comments(ctx.SET().getSymbol()), scope, assignments(ctx.assignment()));
    }

    @Override
    public BeginStatement visitBeginStatement(MySQLParser.BeginStatementContext ctx) {
        return new BeginStatement();
    }

    @Override
    public CommitStatement visitCommitStatement(MySQLParser.CommitStatementContext ctx) {
        return new CommitStatement();
    }

    @Override
    public RollbackStatement visitRollbackStatement(MySQLParser.RollbackStatementContext ctx) {
        return new RollbackStatement();
    }

    @Override
    public ShowStatement visitShowStatement(MySQLParser.ShowStatementContext ctx) {
        List<String> words = new ArrayList<>();
        for (MySQLParser.ShowWordContext wordCtx : ctx.showWord()) {
            words.add(wordCtx.getText());
        }
        Identifier database = ctx.database != null ? visitIdentifier(ctx.database) : null;
        String likePattern = ctx.likePattern != null ? unquote(ctx.likePattern.getText()) : null;
        WhereClause where = ctx.expression() != null
                ? new WhereClause(WhereClause.ClauseType.WHERE, expression(ctx.expression()))
                : null;
        return new ShowStatement(String.join(" ", words), database, likePattern, where);
    }

    @Override
    public UseStatement visitUseStatement(MySQLParser.UseStatementContext ctx) {
        return new UseStatement(visitIdentifier(ctx.identifier()));
    }

    @Override
    public DBDDLStatement visitCreateDatabase(MySQLParser.CreateDatabaseContext ctx) {
        return new DBDDLStatement(DBDDLStatement.Action.CREATE, visitIdentifier(ctx.identifier()), ctx.IF() != null);
    }

    @Override
    public DBDDLStatement visitDropDatabase(MySQLParser.DropDatabaseContext ctx) {
        return new DBDDLStatement(DBDDLStatement.Action.DROP, visitIdentifier(ctx.identifier()), ctx.IF() != null);
    }

    @Override
    public DDLStatement visitCreateTable(MySQLParser.CreateTableContext ctx) {
        return new DDLStatement(DDLStatement.Action.CREATE, visitTableName(ctx.tableName()), null, ctx.IF() != null);
    }

    @Override
    public DDLStatement visitAlterTable(MySQLParser.AlterTableContext ctx) {
        return new DDLStatement(DDLStatement.Action.ALTER, visitTableName(ctx.tableName()), null, false);
    }

    @Override
    public DDLStatement visitDropTable(MySQLParser.DropTableContext ctx) {
        return new DDLStatement(DDLStatement.Action.DROP, visitTableName(ctx.tableName()), null, ctx.IF() != null);
    }

    @Override
    public DDLStatement visitRenameTable(MySQLParser.RenameTableContext ctx) {
        return new DDLStatement(DDLStatement.Action.RENAME, visitTableName(ctx.tableName(0)),
                visitTableName(ctx.tableName(1)), false);
    }

    @Override
    public DDLStatement visitTruncateTable(MySQLParser.TruncateTableContext ctx) {
        return new DDLStatement(DDLStatement.Action.TRUNCATE, visitTableName(ctx.tableName()), null, false);
    }

    @Override
    public StreamStatement visitStreamStatement(MySQLParser.StreamStatementContext ctx) {
        return new StreamStatement(comments(ctx.STREAM().getSymbol()),
                (SelectItem) visit(ctx.selectItem()),
                visitTableName(ctx.tableName()));
    }

    @Override
    public OtherReadStatement visitOtherReadStatement(MySQLParser.OtherReadStatementContext ctx) {
        return new OtherReadStatement();
    }

    @Override
    public OtherAdminStatement visitOtherAdminStatement(MySQLParser.OtherAdminStatementContext ctx) {
        return new OtherAdminStatement();
    }

    // ==================== 逻辑表达式 ====================

    @Override
    public Expression visitNotExpression(MySQLParser.NotExpressionContext ctx) {
        return new NotExpression(expression(ctx.expression()));
    }

    @Override
    public Expression visitAndExpression(MySQLParser.AndExpressionContext ctx) {
        return new AndExpression(expression(ctx.expression(0)), expression(ctx.expression(1)));
    }

    @Override
    public Expression visitXorExpression(MySQLParser.XorExpressionContext ctx) {
        return new BinaryExpression(expression(ctx.expression(0)), Operator.XOR, expression(ctx.expression(1)));
    }

    @Override
    public Expression visitOrExpression(MySQLParser.OrExpressionContext ctx) {
        return new OrExpression(expression(ctx.expression(0)), expression(ctx.expression(1)));
    }

    @Override
    public Expression visitPredicateExpression(MySQLParser.PredicateExpressionContext ctx) {
        return (Expression) visit(ctx.predicate());
    }

    // ==================== 谓词 ====================

    @Override
    public Expression visitInPredicate(MySQLParser.InPredicateContext ctx) {
        ComparisonOperator operator = ctx.NOT() != null ? ComparisonOperator.NOT_IN : ComparisonOperator.IN;
        return new ComparisonExpression((Expression) visit(ctx.predicate()), operator, (Expression) visit(ctx.inTarget()));
    }

    @Override
    public Expression visitSubqueryInTarget(MySQLParser.SubqueryInTargetContext ctx) {
        return new SubqueryExpression((QueryStatement) visit(ctx.selectStatement()));
    }

    @Override
    public Expression visitTupleInTarget(MySQLParser.TupleInTargetContext ctx) {
        List<Expression> values = expressions(ctx.expression());
        // IN (%%SUBQUERY%%) 是子查询通配符,不是单元素元组
        if (values.size() == 1 && isSubqueryWildcard(values.get(0))) {
            return values.get(0);
        }
        return new ValueTupleExpression(values);
    }

    @Override
    public Expression visitWildcardInTarget(MySQLParser.WildcardInTargetContext ctx) {
        return subqueryWildcard();
    }

    @Override
    public Expression visitIsPredicate(MySQLParser.IsPredicateContext ctx) {
        boolean not = ctx.NOT() != null;
        IsExpression.IsOperator operator;
        switch (ctx.isValue.getType()) {
            case MySQLParser.NULL_:
                operator = not ? IsExpression.IsOperator.IS_NOT_NULL : IsExpression.IsOperator.IS_NULL;
                break;
            case MySQLParser.TRUE:
                operator = not ? IsExpression.IsOperator.IS_NOT_TRUE : IsExpression.IsOperator.IS_TRUE;
                break;
            default:
                operator = not ? IsExpression.IsOperator.IS_NOT_FALSE : IsExpression.IsOperator.IS_FALSE;
                break;
        }
        return new IsExpression((Expression) visit(ctx.predicate()), operator);
    }

    @Override
    public Expression visitComparisonPredicate(MySQLParser.ComparisonPredicateContext ctx) {
        String symbol = ctx.comparisonOperator().getText();
        ComparisonOperator operator = ComparisonOperator.fromSymbol(symbol);
        if (operator == null) {
            throw new ParseException("Unknown operator: " + symbol);
        }
        return new ComparisonExpression((Expression) visit(ctx.predicate(0)), operator, (Expression) visit(ctx.predicate(1)));
    }

    @Override
    public Expression visitBetweenPredicate(MySQLParser.BetweenPredicateContext ctx) {
        return new RangeExpression((Expression) visit(ctx.predicate(0)), ctx.NOT() != null,
                (Expression) visit(ctx.predicate(1)), (Expression) visit(ctx.predicate(2)));
    }

    @Override
    public Expression visitLikePredicate(MySQLParser.LikePredicateContext ctx) {
        ComparisonOperator operator = ctx.NOT() != null ? ComparisonOperator.NOT_LIKE : ComparisonOperator.LIKE;
        Expression escape = ctx.escape != null ? (Expression) visit(ctx.escape) : null;
        return new ComparisonExpression((Expression) visit(ctx.predicate(0)), operator,
                (Expression) visit(ctx.predicate(1)), escape);
    }

    @Override
    public Expression visitRegexpPredicate(MySQLParser.RegexpPredicateContext ctx) {
        ComparisonOperator operator = ctx.NOT() != null ? ComparisonOperator.NOT_REGEXP : ComparisonOperator.REGEXP;
        return new ComparisonExpression((Expression) visit(ctx.predicate(0)), operator, (Expression) visit(ctx.predicate(1)));
    }

    @Override
    public Expression visitBitExpressionPredicate(MySQLParser.BitExpressionPredicateContext ctx) {
        return (Expression) visit(ctx.bitExpression());
    }

    // ==================== 算术表达式 ====================

    @Override
    public Expression visitBinaryBitExpression(MySQLParser.BinaryBitExpressionContext ctx) {
        Operator operator = Operator.fromSymbol(ctx.op.getText());
        if (operator == null) {
            throw new ParseException("Unknown operator: " + ctx.op.getText());
        }
        return new BinaryExpression((Expression) visit(ctx.bitExpression(0)), operator,
                (Expression) visit(ctx.bitExpression(1)));
    }

    @Override
    public Expression visitSimpleBitExpression(MySQLParser.SimpleBitExpressionContext ctx) {
        return (Expression) visit(ctx.simpleExpression());
    }

    @Override
    public Expression visitCollateExpression(MySQLParser.CollateExpressionContext ctx) {
        return new CollateExpression((Expression) visit(ctx.simpleExpression()), ctx.charset.getText());
    }

    @Override
    public Expression visitUnaryExpression(MySQLParser.UnaryExpressionContext ctx) {
        Expression operand = (Expression) visit(ctx.simpleExpression());
        UnaryExpression.UnaryOperator operator = UnaryExpression.UnaryOperator.fromSymbol(ctx.op.getText());
        if (operator == null) {
            throw new ParseException("Unknown operator: " + ctx.op.getText());
        }

        // -5 / -2.5 折叠为负数字面量
        if (operator == UnaryExpression.UnaryOperator.MINUS && operand.getType() == Expression.ExpressionType.LITERAL) {
            LiteralExpression literal = (LiteralExpression) operand;
            if (literal.getLiteralType() == LiteralExpression.LiteralType.INTEGER
                    || literal.getLiteralType() == LiteralExpression.LiteralType.FLOAT) {
                String value = literal.getValue();
                String negated = value.startsWith("-") ? value.substring(1) : "-" + value;
                return new LiteralExpression(literal.getLiteralType(), negated);
            }
        }
        return new UnaryExpression(operator, operand);
    }

    @Override
    public Expression visitLiteralExpression(MySQLParser.LiteralExpressionContext ctx) {
        return visitLiteral(ctx.literal());
    }

    @Override
    public Expression visitPositionalArgExpression(MySQLParser.PositionalArgExpressionContext ctx) {
        return new ArgumentExpression(ctx.getText());
    }

    @Override
    public Expression visitNamedArgExpression(MySQLParser.NamedArgExpressionContext ctx) {
        return new ArgumentExpression(ctx.getText());
    }

    @Override
    public Expression visitValueWildcardExpression(MySQLParser.ValueWildcardExpressionContext ctx) {
        return wildcards.valueSentinel();
    }

    @Override
    public Expression visitListOfValuesWildcardExpression(MySQLParser.ListOfValuesWildcardExpressionContext ctx) {
        return wildcards.listOfValuesSentinel();
    }

    @Override
    public Expression visitFunctionCallExpression(MySQLParser.FunctionCallExpressionContext ctx) {
        return (Expression) visit(ctx.functionCall());
    }

    @Override
    public Expression visitColumnExpression(MySQLParser.ColumnExpressionContext ctx) {
        return visitColumnRef(ctx.columnRef());
    }

    @Override
    public Expression visitSubqueryExpression(MySQLParser.SubqueryExpressionContext ctx) {
        return new SubqueryExpression((QueryStatement) visit(ctx.selectStatement()));
    }

    @Override
    public Expression visitSubqueryWildcardExpression(MySQLParser.SubqueryWildcardExpressionContext ctx) {
        return subqueryWildcard();
    }

    @Override
    public Expression visitExistsExpression(MySQLParser.ExistsExpressionContext ctx) {
        return new ExistsExpression(new SubqueryExpression((QueryStatement) visit(ctx.selectStatement())));
    }

    @Override
    public Expression visitExistsWildcardExpression(MySQLParser.ExistsWildcardExpressionContext ctx) {
        return new ExistsExpression(subqueryWildcard());
    }

    @Override
    public Expression visitParenExpression(MySQLParser.ParenExpressionContext ctx) {
        Expression inner = expression(ctx.expression());
        // (%%SUBQUERY%%) 与 (SELECT ...) 一样不额外包一层括号
        if (isSubqueryWildcard(inner)) {
            return inner;
        }
        return new ParenExpression(inner);
    }

    @Override
    public Expression visitTupleExpression(MySQLParser.TupleExpressionContext ctx) {
        return new ValueTupleExpression(expressions(ctx.expression()));
    }

    @Override
    public Expression visitCaseExpression(MySQLParser.CaseExpressionContext ctx) {
        Expression operand = ctx.caseOperand != null ? expression(ctx.caseOperand) : null;
        List<WhenClause> whens = new ArrayList<>();
        for (MySQLParser.WhenClauseContext whenCtx : ctx.whenClause()) {
            whens.add(new WhenClause(expression(whenCtx.condition), expression(whenCtx.result)));
        }
        Expression elseResult = ctx.elseResult != null ? expression(ctx.elseResult) : null;
        return new CaseExpression(operand, whens, elseResult);
    }

    @Override
    public Expression visitIntervalExpression(MySQLParser.IntervalExpressionContext ctx) {
        return new IntervalExpression(expression(ctx.expression()), ctx.unit.getText().toLowerCase(Locale.ROOT));
    }

    @Override
    public Expression visitDefaultExpression(MySQLParser.DefaultExpressionContext ctx) {
        Identifier column = ctx.columnRef() != null ? visitColumnRef(ctx.columnRef()).getName() : null;
        return new DefaultExpression(column);
    }

    // ==================== 函数 ====================

    @Override
    public Expression visitConvertFunction(MySQLParser.ConvertFunctionContext ctx) {
        return new ConvertExpression(expression(ctx.expression()), visitConvertType(ctx.convertType()));
    }

    @Override
    public Expression visitCastFunction(MySQLParser.CastFunctionContext ctx) {
        return new ConvertExpression(expression(ctx.expression()), visitConvertType(ctx.convertType()));
    }

    @Override
    public Expression visitConvertUsingFunction(MySQLParser.ConvertUsingFunctionContext ctx) {
        return new ConvertUsingExpression(expression(ctx.expression()), ctx.charset.getText());
    }

    @Override
    public Expression visitSubstringFunction(MySQLParser.SubstringFunctionContext ctx) {
        Expression to = ctx.to != null ? expression(ctx.to) : null;
        return new SubstringExpression(visitColumnRef(ctx.columnRef()), expression(ctx.from), to);
    }

    @Override
    public Expression visitMatchFunction(MySQLParser.MatchFunctionContext ctx) {
        MatchExpression.MatchOption option = ctx.matchOption() != null
                ? (MatchExpression.MatchOption) visit(ctx.matchOption())
                : MatchExpression.MatchOption.NONE;
        return new MatchExpression(visitSelectItemList(ctx.selectItemList()),
                (Expression) visit(ctx.bitExpression()), option);
    }

    @Override
    public Object visitBooleanModeOption(MySQLParser.BooleanModeOptionContext ctx) {
        return MatchExpression.MatchOption.BOOLEAN_MODE;
    }

    @Override
    public Object visitNaturalLanguageOption(MySQLParser.NaturalLanguageOptionContext ctx) {
        return MatchExpression.MatchOption.NATURAL_LANGUAGE_MODE;
    }

    @Override
    public Object visitNaturalLanguageExpansionOption(MySQLParser.NaturalLanguageExpansionOptionContext ctx) {
        return MatchExpression.MatchOption.NATURAL_LANGUAGE_MODE_WITH_QUERY_EXPANSION;
    }

    @Override
    public Object visitQueryExpansionOption(MySQLParser.QueryExpansionOptionContext ctx) {
        return MatchExpression.MatchOption.QUERY_EXPANSION;
    }

    @Override
    public Expression visitGroupConcatFunction(MySQLParser.GroupConcatFunctionContext ctx) {
        String separator = ctx.separator != null ? unquote(ctx.separator.getText()) : null;
        return new GroupConcatExpression(ctx.DISTINCT() != null, visitSelectItemList(ctx.selectItemList()),
                orderBy(ctx.orderByClause()), separator);
    }

    @Override
    public Expression visitValuesFunction(MySQLParser.ValuesFunctionContext ctx) {
        return new ValuesFunctionExpression(visitColumnRef(ctx.columnRef()));
    }

    @Override
    public Expression visitGenericFunction(MySQLParser.GenericFunctionContext ctx) {
        Identifier qualifier = ctx.qualifier != null ? visitIdentifier(ctx.qualifier) : null;
        MySQLParser.FunctionNameContext nameCtx = ctx.functionName();
        Identifier name = nameCtx.identifier() != null ? visitIdentifier(nameCtx.identifier()) : Identifier.of(nameCtx.getText());
        List<SelectItem> arguments = ctx.selectItemList() != null ? visitSelectItemList(ctx.selectItemList()) : List.of();
        return new FunctionExpression(qualifier, name, ctx.DISTINCT() != null, arguments);
    }

    @Override
    public ConvertType visitConvertType(MySQLParser.ConvertTypeContext ctx) {
        LiteralExpression length = ctx.length != null
                ? new LiteralExpression(LiteralExpression.LiteralType.INTEGER, ctx.length.getText())
                : null;
        LiteralExpression scale = ctx.scale != null
                ? new LiteralExpression(LiteralExpression.LiteralType.INTEGER, ctx.scale.getText())
                : null;
        String charset = ctx.charsetSpec() != null ? ctx.charsetSpec().charset.getText() : null;
        return new ConvertType(ctx.typeName.getText().toLowerCase(Locale.ROOT), length, scale, charset);
    }

    // ==================== 列与标识符 ====================

    @Override
    public ColumnExpression visitColumnRef(MySQLParser.ColumnRefContext ctx) {
        TableName qualifier = null;
        if (ctx.table != null) {
            Identifier schema = ctx.schema != null ? visitIdentifier(ctx.schema) : null;
            qualifier = new TableName(schema, visitIdentifier(ctx.table));
        }
        return new ColumnExpression(qualifier, visitColumnIdentifier(ctx.columnIdentifier()));
    }

    @Override
    public Identifier visitColumnIdentifier(MySQLParser.ColumnIdentifierContext ctx) {
        if (ctx.COLUMN_WILDCARD() != null) {
            return wildcards.columnSentinel();
        }
        return visitIdentifier(ctx.identifier());
    }

    private List<Identifier> columnIdentifiers(List<MySQLParser.ColumnIdentifierContext> contexts) {
        List<Identifier> identifiers = new ArrayList<>();
        for (MySQLParser.ColumnIdentifierContext identCtx : contexts) {
            identifiers.add(visitColumnIdentifier(identCtx));
        }
        return identifiers;
    }

    @Override
    public Identifier visitIdentifier(MySQLParser.IdentifierContext ctx) {
        if (ctx.BACKTICK_IDENTIFIER() != null) {
            String text = ctx.getText();
            return Identifier.of(text.substring(1, text.length() - 1).replace("``", "`"));
        }
        return Identifier.of(ctx.getText());
    }

    // ==================== 字面量 ====================

    @Override
    public Expression visitLiteral(MySQLParser.LiteralContext ctx) {
        Token token = ctx.getStart();
        String text = token.getText();
        switch (token.getType()) {
            case MySQLParser.STRING_LITERAL:
                return LiteralExpression.string(unquote(text));
            case MySQLParser.INTEGER_LITERAL:
                return new LiteralExpression(LiteralExpression.LiteralType.INTEGER, text);
            case MySQLParser.DECIMAL_LITERAL:
                return new LiteralExpression(LiteralExpression.LiteralType.FLOAT, text);
            case MySQLParser.HEX_LITERAL:
                // X'1F' 只保留引号内的十六进制数字
                return new LiteralExpression(LiteralExpression.LiteralType.HEX_STRING,
                        text.substring(2, text.length() - 1));
            case MySQLParser.HEXNUM_LITERAL:
                return new LiteralExpression(LiteralExpression.LiteralType.HEX_NUMBER, text);
            case MySQLParser.BIT_LITERAL:
                return new LiteralExpression(LiteralExpression.LiteralType.BIT_STRING,
                        text.substring(2, text.length() - 1));
            case MySQLParser.NULL_:
                return new NullExpression();
            case MySQLParser.TRUE:
                return new BoolExpression(true);
            case MySQLParser.FALSE:
                return new BoolExpression(false);
            default:
                throw new ParseException("Unknown literal: " + text);
        }
    }

    /**
     * 去除字符串字面量的引号并处理转义
     *
     * 支持 '' / "" 双写转义和反斜杠转义。\% 和 \_ 保留反斜杠(LIKE模式中有意义)。
     */
    static String unquote(String text) {
        char quote = text.charAt(0);
        String body = text.substring(1, text.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == quote && i + 1 < body.length() && body.charAt(i + 1) == quote) {
                sb.append(quote);
                i++;
            } else if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 'b':
                        sb.append('\b');
                        break;
                    case '0':
                        sb.append('\0');
                        break;
                    case 'Z':
                        sb.append('\032');
                        break;
                    case '%':
                    case '_':
                        sb.append('\\').append(next);
                        break;
                    default:
                        sb.append(next);
                        break;
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // ==================== 辅助方法 ====================

    private Expression expression(MySQLParser.ExpressionContext ctx) {
        return (Expression) visit(ctx);
    }

    private List<Expression> expressions(List<MySQLParser.ExpressionContext> contexts) {
        List<Expression> expressions = new ArrayList<>();
        for (MySQLParser.ExpressionContext exprCtx : contexts) {
            expressions.add(expression(exprCtx));
        }
        return expressions;
    }

    private SubqueryExpression subqueryWildcard() {
        return new SubqueryExpression(wildcards.subquerySentinel());
    }

    private boolean isSubqueryWildcard(Expression expression) {
        return expression.getType() == Expression.ExpressionType.SUBQUERY
                && wildcards.isSubqueryWildcard((SubqueryExpression) expression);
    }

    /**
     * 收集紧跟在关键字之后的块注释
     *
     * @param keyword SELECT / INSERT / UPDATE / DELETE / SET / STREAM 关键字
     * @return 注释原文(含 /* *&#47;),按出现顺序
     */
    private List<String> comments(Token keyword) {
        List<String> comments = new ArrayList<>();
        List<Token> hidden = tokens.getHiddenTokensToRight(keyword.getTokenIndex(), Token.HIDDEN_CHANNEL);
        if (hidden == null) {
            return comments;
        }
        for (Token token : hidden) {
            if (token.getType() == MySQLParser.BLOCK_COMMENT) {
                comments.add(token.getText());
            }
        }
        return comments;
    }
}

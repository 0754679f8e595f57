package com.solidity.parser;

import com.solidity.parser.ast.ArrayTypeName;
import com.solidity.parser.ast.AssemblyAssignment;
import com.solidity.parser.ast.AssemblyBlock;
import com.solidity.parser.ast.AssemblyCall;
import com.solidity.parser.ast.AssemblyCase;
import com.solidity.parser.ast.AssemblyExpression;
import com.solidity.parser.ast.AssemblyFor;
import com.solidity.parser.ast.AssemblyFunctionDefinition;
import com.solidity.parser.ast.AssemblyIf;
import com.solidity.parser.ast.AssemblyItem;
import com.solidity.parser.ast.AssemblyLocalDefinition;
import com.solidity.parser.ast.AssemblyMemberAccess;
import com.solidity.parser.ast.AssemblyStackAssignment;
import com.solidity.parser.ast.AssemblySwitch;
import com.solidity.parser.ast.AstNode;
import com.solidity.parser.ast.BinaryOperation;
import com.solidity.parser.ast.BinaryOperator;
import com.solidity.parser.ast.Block;
import com.solidity.parser.ast.BooleanLiteral;
import com.solidity.parser.ast.Break;
import com.solidity.parser.ast.BreakStatement;
import com.solidity.parser.ast.CatchClause;
import com.solidity.parser.ast.Conditional;
import com.solidity.parser.ast.Continue;
import com.solidity.parser.ast.ContinueStatement;
import com.solidity.parser.ast.ContractDefinition;
import com.solidity.parser.ast.ContractKind;
import com.solidity.parser.ast.ContractPart;
import com.solidity.parser.ast.CustomErrorDefinition;
import com.solidity.parser.ast.DecimalNumber;
import com.solidity.parser.ast.DoWhileStatement;
import com.solidity.parser.ast.ElementaryTypeName;
import com.solidity.parser.ast.EmitStatement;
import com.solidity.parser.ast.EnumDefinition;
import com.solidity.parser.ast.EnumValue;
import com.solidity.parser.ast.EventDefinition;
import com.solidity.parser.ast.Expression;
import com.solidity.parser.ast.ExpressionStatement;
import com.solidity.parser.ast.FileLevelConstant;
import com.solidity.parser.ast.ForStatement;
import com.solidity.parser.ast.FunctionCall;
import com.solidity.parser.ast.FunctionDefinition;
import com.solidity.parser.ast.FunctionTypeName;
import com.solidity.parser.ast.HexLiteral;
import com.solidity.parser.ast.HexNumber;
import com.solidity.parser.ast.Identifier;
import com.solidity.parser.ast.IfStatement;
import com.solidity.parser.ast.ImportDirective;
import com.solidity.parser.ast.IndexAccess;
import com.solidity.parser.ast.IndexRangeAccess;
import com.solidity.parser.ast.InheritanceSpecifier;
import com.solidity.parser.ast.InlineAssemblyStatement;
import com.solidity.parser.ast.LabelDefinition;
import com.solidity.parser.ast.Mapping;
import com.solidity.parser.ast.MemberAccess;
import com.solidity.parser.ast.ModifierDefinition;
import com.solidity.parser.ast.ModifierInvocation;
import com.solidity.parser.ast.NameValueExpression;
import com.solidity.parser.ast.NameValueList;
import com.solidity.parser.ast.NewExpression;
import com.solidity.parser.ast.NumberLiteral;
import com.solidity.parser.ast.PragmaDirective;
import com.solidity.parser.ast.ReturnStatement;
import com.solidity.parser.ast.RevertStatement;
import com.solidity.parser.ast.SourceUnit;
import com.solidity.parser.ast.SourceUnitPart;
import com.solidity.parser.ast.StateVariableDeclaration;
import com.solidity.parser.ast.StateVariableDeclarationVariable;
import com.solidity.parser.ast.Statement;
import com.solidity.parser.ast.StringLiteral;
import com.solidity.parser.ast.StructDefinition;
import com.solidity.parser.ast.SymbolAlias;
import com.solidity.parser.ast.ThrowStatement;
import com.solidity.parser.ast.TryStatement;
import com.solidity.parser.ast.TupleExpression;
import com.solidity.parser.ast.TypeDefinition;
import com.solidity.parser.ast.TypeName;
import com.solidity.parser.ast.UnaryOperation;
import com.solidity.parser.ast.UnaryOperator;
import com.solidity.parser.ast.UncheckedStatement;
import com.solidity.parser.ast.UserDefinedTypeName;
import com.solidity.parser.ast.UsingForDeclaration;
import com.solidity.parser.ast.VariableDeclaration;
import com.solidity.parser.ast.VariableDeclarationStatement;
import com.solidity.parser.ast.Visibility;
import com.solidity.parser.ast.WhileStatement;
import com.solidity.parser.grammar.SolidityParser;
import com.solidity.parser.grammar.SolidityVisitor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.AbstractParseTreeVisitor;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Reduces a Solidity parse tree to the typed syntax tree.
 *
 * <p>Every grammar rule has its own visit method, so a rule added to the grammar does not compile until
 * it is handled here. Rules that only give the grammar structure (parameter lists, modifier lists,
 * storage locations and the like) are read by their enclosing rule and throw when visited on their
 * own. All recursion goes through {@link #reduce}, which checks the type of the node produced and
 * enforces the nesting limit.</p>
 *
 * <p>A reducer holds per-parse state and is used for a single parse.</p>
 */
final class AstReducer extends AbstractParseTreeVisitor<AstNode> implements SolidityVisitor<AstNode> {
    private static final Logger LOGGER = Logger.getLogger(AstReducer.class.getName());

    private final NodeMetadata metadata;
    private final int maxDepth;
    private final Deque<String> contractNames = new ArrayDeque<>();
    private int depth;

    AstReducer(NodeMetadata metadata, int maxDepth) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.maxDepth = maxDepth;
    }

    SourceUnit reduceSourceUnit(SolidityParser.SourceUnitContext context) {
        return reduce(context, SourceUnit.class);
    }

    // Top level

    @Override
    public SourceUnit visitSourceUnit(SolidityParser.SourceUnitContext ctx) {
        List<ParseTree> members = new ArrayList<>();
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof ParserRuleContext) {
                members.add(child);
            }
        }
        return meta(new SourceUnit(reduceMembers(members, SourceUnitPart.class)), ctx);
    }

    @Override
    public PragmaDirective visitPragmaDirective(SolidityParser.PragmaDirectiveContext ctx) {
        String name = text(ctx.pragmaName(), "pragma name");
        SolidityParser.PragmaValueContext value = required(ctx.pragmaValue(), "pragma value");
        String valueText = value.getText();
        SolidityParser.VersionContext version = value.version();
        if (version != null) {
            List<String> constraints = new ArrayList<>();
            for (int i = 0; i < version.getChildCount(); i++) {
                constraints.add(version.getChild(i).getText());
            }
            valueText = String.join(" ", constraints);
        }
        return meta(new PragmaDirective(name, valueText), ctx);
    }

    @Override
    public AstNode visitPragmaName(SolidityParser.PragmaNameContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitPragmaValue(SolidityParser.PragmaValueContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitVersion(SolidityParser.VersionContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitVersionOperator(SolidityParser.VersionOperatorContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitVersionConstraint(SolidityParser.VersionConstraintContext ctx) {
        throw folded(ctx);
    }

    @Override
    public ImportDirective visitImportDirective(SolidityParser.ImportDirectiveContext ctx) {
        SolidityParser.ImportPathContext importPath = required(ctx.importPath(), "import path");
        String path = unquote(importPath.getText());
        StringLiteral pathLiteral = meta(StringLiteral.of(path), importPath);

        Identifier unitAlias = null;
        List<SymbolAlias> symbolAliases = null;
        if (!ctx.importDeclaration().isEmpty()) {
            symbolAliases = new ArrayList<>();
            for (SolidityParser.ImportDeclarationContext declaration : ctx.importDeclaration()) {
                symbolAliases.add(
                        new SymbolAlias(
                                reduce(declaration.identifier(0), Identifier.class),
                                reduceOptional(declaration.identifier(1), Identifier.class)));
            }
        } else {
            List<SolidityParser.IdentifierContext> identifiers = ctx.identifier();
            if (identifiers.size() > 2) {
                throw new ReductionException("An import has at most two identifiers, found " + identifiers.size());
            }
            if (!identifiers.isEmpty()) {
                unitAlias = reduce(identifiers.get(identifiers.size() - 1), Identifier.class);
            }
        }
        return meta(new ImportDirective(path, pathLiteral, unitAlias, symbolAliases), ctx);
    }

    @Override
    public AstNode visitImportDeclaration(SolidityParser.ImportDeclarationContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitImportPath(SolidityParser.ImportPathContext ctx) {
        throw folded(ctx);
    }

    @Override
    public ContractDefinition visitContractDefinition(SolidityParser.ContractDefinitionContext ctx) {
        boolean isAbstract = "abstract".equals(childText(ctx, 0));
        ContractKind kind = contractKind(childText(ctx, isAbstract ? 1 : 0));
        String name = text(ctx.identifier(), "contract name");
        List<InheritanceSpecifier> baseContracts =
                reduceAll(ctx.inheritanceSpecifier(), InheritanceSpecifier.class);

        List<ContractPart> parts;
        contractNames.push(name);
        try {
            parts = reduceMembers(ctx.contractPart(), ContractPart.class);
        } finally {
            contractNames.pop();
        }
        return meta(new ContractDefinition(name, kind, isAbstract, baseContracts, parts), ctx);
    }

    private static ContractKind contractKind(String keyword) {
        return switch (keyword) {
            case "contract" -> ContractKind.CONTRACT;
            case "interface" -> ContractKind.INTERFACE;
            case "library" -> ContractKind.LIBRARY;
            default -> throw new ReductionException("Unknown contract kind '" + keyword + "'");
        };
    }

    @Override
    public InheritanceSpecifier visitInheritanceSpecifier(SolidityParser.InheritanceSpecifierContext ctx) {
        SolidityParser.ExpressionListContext expressionList = ctx.expressionList();
        List<Expression> arguments =
                expressionList == null ? List.of() : reduceAll(expressionList.expression(), Expression.class);
        return meta(
                new InheritanceSpecifier(reduce(ctx.userDefinedTypeName(), UserDefinedTypeName.class), arguments),
                ctx);
    }

    @Override
    public AstNode visitContractPart(SolidityParser.ContractPartContext ctx) {
        return delegate(ctx);
    }

    // Declarations

    @Override
    public StateVariableDeclaration visitStateVariableDeclaration(
            SolidityParser.StateVariableDeclarationContext ctx) {
        TypeName typeName = reduce(ctx.typeName(), TypeName.class);
        Identifier identifier = reduce(ctx.identifier(), Identifier.class);
        Expression expression = reduceOptional(ctx.expression(), Expression.class);

        Visibility visibility = Visibility.DEFAULT;
        if (!ctx.InternalKeyword().isEmpty()) {
            visibility = Visibility.INTERNAL;
        } else if (!ctx.PublicKeyword().isEmpty()) {
            visibility = Visibility.PUBLIC;
        } else if (!ctx.PrivateKeyword().isEmpty()) {
            visibility = Visibility.PRIVATE;
        }

        StateVariableDeclarationVariable variable =
                meta(
                        new StateVariableDeclarationVariable(
                                typeName,
                                identifier,
                                expression,
                                visibility,
                                !ctx.ConstantKeyword().isEmpty(),
                                !ctx.ImmutableKeyword().isEmpty(),
                                override(ctx.overrideSpecifier())),
                        ctx);
        return meta(new StateVariableDeclaration(List.of(variable), expression), ctx);
    }

    @Override
    public FileLevelConstant visitFileLevelConstant(SolidityParser.FileLevelConstantContext ctx) {
        return meta(
                new FileLevelConstant(
                        reduce(ctx.typeName(), TypeName.class),
                        text(ctx.identifier(), "constant name"),
                        reduce(ctx.expression(), Expression.class)),
                ctx);
    }

    @Override
    public CustomErrorDefinition visitCustomErrorDefinition(SolidityParser.CustomErrorDefinitionContext ctx) {
        return meta(
                new CustomErrorDefinition(text(ctx.identifier(), "error name"), parameters(ctx.parameterList())),
                ctx);
    }

    @Override
    public TypeDefinition visitTypeDefinition(SolidityParser.TypeDefinitionContext ctx) {
        return meta(
                new TypeDefinition(
                        text(ctx.identifier(), "type name"),
                        reduce(ctx.elementaryTypeName(), ElementaryTypeName.class)),
                ctx);
    }

    @Override
    public UsingForDeclaration visitUsingForDeclaration(SolidityParser.UsingForDeclarationContext ctx) {
        TypeName typeName = reduceOptional(ctx.typeName(), TypeName.class);
        boolean isGlobal = ctx.GlobalKeyword() != null;
        SolidityParser.UsingForObjectContext object = required(ctx.usingForObject(), "using-for library");

        if (object.userDefinedTypeName() != null) {
            return meta(
                    new UsingForDeclaration(
                            typeName, object.userDefinedTypeName().getText(), List.of(), List.of(), isGlobal),
                    ctx);
        }
        List<String> functions = new ArrayList<>();
        List<String> operators = new ArrayList<>();
        for (SolidityParser.UsingForObjectDirectiveContext directive : object.usingForObjectDirective()) {
            functions.add(text(directive.userDefinedTypeName(), "using-for function"));
            SolidityParser.UserDefinableOperatorsContext operator = directive.userDefinableOperators();
            operators.add(operator == null ? null : operator.getText());
        }
        return meta(new UsingForDeclaration(typeName, null, functions, operators, isGlobal), ctx);
    }

    @Override
    public AstNode visitUsingForObject(SolidityParser.UsingForObjectContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitUsingForObjectDirective(SolidityParser.UsingForObjectDirectiveContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitUserDefinableOperators(SolidityParser.UserDefinableOperatorsContext ctx) {
        throw folded(ctx);
    }

    @Override
    public StructDefinition visitStructDefinition(SolidityParser.StructDefinitionContext ctx) {
        return meta(
                new StructDefinition(
                        text(ctx.identifier(), "struct name"),
                        reduceAll(ctx.variableDeclaration(), VariableDeclaration.class)),
                ctx);
    }

    @Override
    public ModifierDefinition visitModifierDefinition(SolidityParser.ModifierDefinitionContext ctx) {
        List<VariableDeclaration> parameters =
                ctx.parameterList() == null ? null : parameters(ctx.parameterList());
        return meta(
                new ModifierDefinition(
                        text(ctx.identifier(), "modifier name"),
                        parameters,
                        !ctx.VirtualKeyword().isEmpty(),
                        override(ctx.overrideSpecifier()),
                        reduceOptional(ctx.block(), Block.class)),
                ctx);
    }

    @Override
    public ModifierInvocation visitModifierInvocation(SolidityParser.ModifierInvocationContext ctx) {
        SolidityParser.ExpressionListContext expressionList = ctx.expressionList();
        List<Expression> arguments =
                expressionList == null ? List.of() : reduceAll(expressionList.expression(), Expression.class);
        if (arguments.isEmpty() && ctx.getChildCount() > 1) {
            // written as `name()`
            arguments = null;
        }
        return meta(new ModifierInvocation(text(ctx.identifier(), "modifier name"), arguments), ctx);
    }

    /**
     * Classifies by the descriptor keyword. Only the plain {@code function} form is subject to the legacy
     * rules: no name means fallback, a name equal to the enclosing contract means constructor.
     */
    @Override
    public FunctionDefinition visitFunctionDefinition(SolidityParser.FunctionDefinitionContext ctx) {
        SolidityParser.FunctionDescriptorContext descriptor =
                required(ctx.functionDescriptor(), "function descriptor");
        SolidityParser.ModifierListContext modifierList = required(ctx.modifierList(), "modifier list");

        List<ModifierInvocation> modifiers =
                reduceAll(modifierList.modifierInvocation(), ModifierInvocation.class);
        String stateMutability = stateMutability(modifierList.stateMutability());
        Block body = reduceOptional(ctx.block(), Block.class);

        String name = null;
        List<VariableDeclaration> parameters = List.of();
        List<VariableDeclaration> returnParameters = null;
        Visibility visibility = Visibility.DEFAULT;
        boolean isConstructor = false;
        boolean isFallback = false;
        boolean isReceiveEther = false;

        String keyword = childText(descriptor, 0);
        switch (keyword) {
            case "constructor" -> {
                isConstructor = true;
                parameters = parameters(ctx.parameterList());
                if (!modifierList.InternalKeyword().isEmpty()) {
                    visibility = Visibility.INTERNAL;
                } else if (!modifierList.PublicKeyword().isEmpty()) {
                    visibility = Visibility.PUBLIC;
                }
            }
            case "fallback" -> {
                isFallback = true;
                parameters = parameters(ctx.parameterList());
                visibility = Visibility.EXTERNAL;
                returnParameters = returnParameters(ctx.returnParameters());
            }
            case "receive" -> {
                // any written parameter list is ignored
                isReceiveEther = true;
                visibility = Visibility.EXTERNAL;
            }
            case "function" -> {
                name = descriptor.identifier() == null ? "" : descriptor.identifier().getText();
                parameters = parameters(ctx.parameterList());
                returnParameters = returnParameters(ctx.returnParameters());
                visibility = functionVisibility(modifierList);
                isFallback = name.isEmpty();
                isConstructor = !isFallback && name.equals(contractNames.peek());
            }
            default -> throw new ReductionException("Unknown function descriptor '" + keyword + "'");
        }

        return meta(
                new FunctionDefinition(
                        name,
                        parameters,
                        modifiers,
                        stateMutability,
                        visibility,
                        returnParameters,
                        body,
                        override(modifierList.overrideSpecifier()),
                        isConstructor,
                        isReceiveEther,
                        isFallback,
                        !modifierList.VirtualKeyword().isEmpty()),
                ctx);
    }

    private static Visibility functionVisibility(SolidityParser.ModifierListContext modifierList) {
        if (!modifierList.ExternalKeyword().isEmpty()) {
            return Visibility.EXTERNAL;
        }
        if (!modifierList.InternalKeyword().isEmpty()) {
            return Visibility.INTERNAL;
        }
        if (!modifierList.PublicKeyword().isEmpty()) {
            return Visibility.PUBLIC;
        }
        if (!modifierList.PrivateKeyword().isEmpty()) {
            return Visibility.PRIVATE;
        }
        return Visibility.DEFAULT;
    }

    @Override
    public AstNode visitFunctionDescriptor(SolidityParser.FunctionDescriptorContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitReturnParameters(SolidityParser.ReturnParametersContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitModifierList(SolidityParser.ModifierListContext ctx) {
        throw folded(ctx);
    }

    @Override
    public EventDefinition visitEventDefinition(SolidityParser.EventDefinitionContext ctx) {
        SolidityParser.EventParameterListContext parameterList =
                required(ctx.eventParameterList(), "event parameter list");
        return meta(
                new EventDefinition(
                        text(ctx.identifier(), "event name"),
                        reduceAll(parameterList.eventParameter(), VariableDeclaration.class),
                        ctx.AnonymousKeyword() != null),
                ctx);
    }

    @Override
    public EnumValue visitEnumValue(SolidityParser.EnumValueContext ctx) {
        return meta(new EnumValue(text(ctx.identifier(), "enum value")), ctx);
    }

    @Override
    public EnumDefinition visitEnumDefinition(SolidityParser.EnumDefinitionContext ctx) {
        return meta(
                new EnumDefinition(text(ctx.identifier(), "enum name"), reduceAll(ctx.enumValue(), EnumValue.class)),
                ctx);
    }

    @Override
    public AstNode visitParameterList(SolidityParser.ParameterListContext ctx) {
        throw folded(ctx);
    }

    @Override
    public VariableDeclaration visitParameter(SolidityParser.ParameterContext ctx) {
        return meta(
                new VariableDeclaration(
                        reduce(ctx.typeName(), TypeName.class),
                        reduceOptional(ctx.identifier(), Identifier.class),
                        storageLocation(ctx.storageLocation()),
                        false),
                ctx);
    }

    @Override
    public AstNode visitEventParameterList(SolidityParser.EventParameterListContext ctx) {
        throw folded(ctx);
    }

    @Override
    public VariableDeclaration visitEventParameter(SolidityParser.EventParameterContext ctx) {
        return meta(
                new VariableDeclaration(
                        reduce(ctx.typeName(), TypeName.class),
                        reduceOptional(ctx.identifier(), Identifier.class),
                        null,
                        ctx.IndexedKeyword() != null),
                ctx);
    }

    @Override
    public AstNode visitFunctionTypeParameterList(SolidityParser.FunctionTypeParameterListContext ctx) {
        throw folded(ctx);
    }

    @Override
    public VariableDeclaration visitFunctionTypeParameter(SolidityParser.FunctionTypeParameterContext ctx) {
        return meta(
                new VariableDeclaration(
                        reduce(ctx.typeName(), TypeName.class), null, storageLocation(ctx.storageLocation()), false),
                ctx);
    }

    @Override
    public VariableDeclaration visitVariableDeclaration(SolidityParser.VariableDeclarationContext ctx) {
        return meta(
                new VariableDeclaration(
                        reduce(ctx.typeName(), TypeName.class),
                        reduce(ctx.identifier(), Identifier.class),
                        storageLocation(ctx.storageLocation()),
                        false),
                ctx);
    }

    // Type names

    @Override
    public AstNode visitTypeName(SolidityParser.TypeNameContext ctx) {
        if (ctx.getChildCount() == 2 && ctx.PayableKeyword() != null) {
            return meta(new ElementaryTypeName(childText(ctx, 0), "payable"), ctx);
        }
        if (ctx.typeName() != null) {
            return meta(
                    new ArrayTypeName(
                            reduce(ctx.typeName(), TypeName.class), reduceOptional(ctx.expression(), Expression.class)),
                    ctx);
        }
        if (ctx.elementaryTypeName() != null) {
            return reduce(ctx.elementaryTypeName(), ElementaryTypeName.class);
        }
        if (ctx.userDefinedTypeName() != null) {
            return reduce(ctx.userDefinedTypeName(), UserDefinedTypeName.class);
        }
        if (ctx.mapping() != null) {
            return reduce(ctx.mapping(), Mapping.class);
        }
        if (ctx.functionTypeName() != null) {
            return reduce(ctx.functionTypeName(), FunctionTypeName.class);
        }
        throw new ReductionException("Unrecognized type name '" + ctx.getText() + "'");
    }

    @Override
    public UserDefinedTypeName visitUserDefinedTypeName(SolidityParser.UserDefinedTypeNameContext ctx) {
        return meta(new UserDefinedTypeName(ctx.getText()), ctx);
    }

    @Override
    public AstNode visitMappingKey(SolidityParser.MappingKeyContext ctx) {
        if (ctx.elementaryTypeName() != null) {
            return reduce(ctx.elementaryTypeName(), ElementaryTypeName.class);
        }
        if (ctx.userDefinedTypeName() != null) {
            return reduce(ctx.userDefinedTypeName(), UserDefinedTypeName.class);
        }
        throw new ReductionException("Mapping key must be an elementary or user defined type name");
    }

    @Override
    public Mapping visitMapping(SolidityParser.MappingContext ctx) {
        SolidityParser.MappingKeyNameContext keyName = ctx.mappingKeyName();
        SolidityParser.MappingValueNameContext valueName = ctx.mappingValueName();
        return meta(
                new Mapping(
                        reduce(ctx.mappingKey(), TypeName.class),
                        keyName == null ? null : reduce(keyName.identifier(), Identifier.class),
                        reduce(ctx.typeName(), TypeName.class),
                        valueName == null ? null : reduce(valueName.identifier(), Identifier.class)),
                ctx);
    }

    @Override
    public AstNode visitMappingKeyName(SolidityParser.MappingKeyNameContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitMappingValueName(SolidityParser.MappingValueNameContext ctx) {
        throw folded(ctx);
    }

    @Override
    public FunctionTypeName visitFunctionTypeName(SolidityParser.FunctionTypeNameContext ctx) {
        List<SolidityParser.FunctionTypeParameterListContext> lists = ctx.functionTypeParameterList();
        if (lists.isEmpty()) {
            throw new ReductionException("Function type without parameter list");
        }
        List<VariableDeclaration> parameterTypes =
                reduceAll(lists.get(0).functionTypeParameter(), VariableDeclaration.class);
        List<VariableDeclaration> returnTypes =
                lists.size() > 1
                        ? reduceAll(lists.get(1).functionTypeParameter(), VariableDeclaration.class)
                        : List.of();

        Visibility visibility = Visibility.DEFAULT;
        if (!ctx.InternalKeyword().isEmpty()) {
            visibility = Visibility.INTERNAL;
        } else if (!ctx.ExternalKeyword().isEmpty()) {
            visibility = Visibility.EXTERNAL;
        }
        return meta(
                new FunctionTypeName(
                        parameterTypes, returnTypes, visibility, stateMutability(ctx.stateMutability())),
                ctx);
    }

    @Override
    public AstNode visitStorageLocation(SolidityParser.StorageLocationContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitStateMutability(SolidityParser.StateMutabilityContext ctx) {
        throw folded(ctx);
    }

    @Override
    public ElementaryTypeName visitElementaryTypeName(SolidityParser.ElementaryTypeNameContext ctx) {
        return meta(new ElementaryTypeName(ctx.getText(), null), ctx);
    }

    // Statements

    @Override
    public Block visitBlock(SolidityParser.BlockContext ctx) {
        return meta(new Block(reduceMembers(ctx.statement(), Statement.class)), ctx);
    }

    @Override
    public AstNode visitStatement(SolidityParser.StatementContext ctx) {
        return delegate(ctx);
    }

    @Override
    public ExpressionStatement visitExpressionStatement(SolidityParser.ExpressionStatementContext ctx) {
        return meta(new ExpressionStatement(reduce(ctx.expression(), Expression.class)), ctx);
    }

    @Override
    public IfStatement visitIfStatement(SolidityParser.IfStatementContext ctx) {
        return meta(
                new IfStatement(
                        reduce(ctx.expression(), Expression.class),
                        reduce(ctx.statement(0), Statement.class),
                        reduceOptional(ctx.statement(1), Statement.class)),
                ctx);
    }

    @Override
    public TryStatement visitTryStatement(SolidityParser.TryStatementContext ctx) {
        return meta(
                new TryStatement(
                        reduce(ctx.expression(), Expression.class),
                        returnParameters(ctx.returnParameters()),
                        reduce(ctx.block(), Block.class),
                        reduceAll(ctx.catchClause(), CatchClause.class)),
                ctx);
    }

    @Override
    public CatchClause visitCatchClause(SolidityParser.CatchClauseContext ctx) {
        String kind = null;
        if (ctx.identifier() != null) {
            kind = ctx.identifier().getText();
            if (!kind.equals("Error") && !kind.equals("Panic")) {
                throw new ReductionException("Expected 'Error' or 'Panic' in catch clause, found '" + kind + "'");
            }
        }
        List<VariableDeclaration> parameters =
                ctx.parameterList() == null ? null : parameters(ctx.parameterList());
        return meta(new CatchClause(kind, parameters, reduce(ctx.block(), Block.class)), ctx);
    }

    @Override
    public WhileStatement visitWhileStatement(SolidityParser.WhileStatementContext ctx) {
        return meta(
                new WhileStatement(
                        reduce(ctx.expression(), Expression.class), reduce(ctx.statement(), Statement.class)),
                ctx);
    }

    @Override
    public AstNode visitSimpleStatement(SolidityParser.SimpleStatementContext ctx) {
        return delegate(ctx);
    }

    @Override
    public UncheckedStatement visitUncheckedStatement(SolidityParser.UncheckedStatementContext ctx) {
        return meta(new UncheckedStatement(reduce(ctx.block(), Block.class)), ctx);
    }

    @Override
    public ForStatement visitForStatement(SolidityParser.ForStatementContext ctx) {
        SolidityParser.ExpressionStatementContext condition = ctx.expressionStatement();
        ExpressionStatement loopExpression = null;
        if (ctx.expression() != null) {
            loopExpression =
                    meta(new ExpressionStatement(reduce(ctx.expression(), Expression.class)), ctx.expression());
        }
        return meta(
                new ForStatement(
                        reduceOptional(ctx.simpleStatement(), Statement.class),
                        condition == null ? null : reduce(condition.expression(), Expression.class),
                        loopExpression,
                        reduce(ctx.statement(), Statement.class)),
                ctx);
    }

    @Override
    public InlineAssemblyStatement visitInlineAssemblyStatement(
            SolidityParser.InlineAssemblyStatementContext ctx) {
        String language = null;
        if (ctx.StringLiteralFragment() != null) {
            language = unquote(ctx.StringLiteralFragment().getText());
        }
        List<String> flags = new ArrayList<>();
        SolidityParser.InlineAssemblyStatementFlagContext flagList = ctx.inlineAssemblyStatementFlag();
        if (flagList != null) {
            for (SolidityParser.StringLiteralContext flag : flagList.stringLiteral()) {
                flags.add(toStringLiteral(flag).getValue());
            }
        }
        return meta(
                new InlineAssemblyStatement(language, flags, reduce(ctx.assemblyBlock(), AssemblyBlock.class)),
                ctx);
    }

    @Override
    public AstNode visitInlineAssemblyStatementFlag(SolidityParser.InlineAssemblyStatementFlagContext ctx) {
        throw folded(ctx);
    }

    @Override
    public DoWhileStatement visitDoWhileStatement(SolidityParser.DoWhileStatementContext ctx) {
        return meta(
                new DoWhileStatement(
                        reduce(ctx.expression(), Expression.class), reduce(ctx.statement(), Statement.class)),
                ctx);
    }

    @Override
    public ContinueStatement visitContinueStatement(SolidityParser.ContinueStatementContext ctx) {
        return meta(new ContinueStatement(), ctx);
    }

    @Override
    public BreakStatement visitBreakStatement(SolidityParser.BreakStatementContext ctx) {
        return meta(new BreakStatement(), ctx);
    }

    @Override
    public ReturnStatement visitReturnStatement(SolidityParser.ReturnStatementContext ctx) {
        return meta(new ReturnStatement(reduceOptional(ctx.expression(), Expression.class)), ctx);
    }

    @Override
    public ThrowStatement visitThrowStatement(SolidityParser.ThrowStatementContext ctx) {
        return meta(new ThrowStatement(), ctx);
    }

    @Override
    public EmitStatement visitEmitStatement(SolidityParser.EmitStatementContext ctx) {
        return meta(new EmitStatement(reduce(ctx.functionCall(), FunctionCall.class)), ctx);
    }

    @Override
    public RevertStatement visitRevertStatement(SolidityParser.RevertStatementContext ctx) {
        return meta(new RevertStatement(reduce(ctx.functionCall(), FunctionCall.class)), ctx);
    }

    @Override
    public VariableDeclarationStatement visitVariableDeclarationStatement(
            SolidityParser.VariableDeclarationStatementContext ctx) {
        List<VariableDeclaration> variables;
        if (ctx.variableDeclaration() != null) {
            variables = List.of(reduce(ctx.variableDeclaration(), VariableDeclaration.class));
        } else if (ctx.identifierList() != null) {
            variables = untypedDeclarations(ctx.identifierList());
        } else if (ctx.variableDeclarationList() != null) {
            variables = declarationList(ctx.variableDeclarationList());
        } else {
            throw new ReductionException("Variable declaration statement without variables");
        }
        return meta(
                new VariableDeclarationStatement(variables, reduceOptional(ctx.expression(), Expression.class)),
                ctx);
    }

    /** {@code var (a, , b)}: declarations without a type name, {@code null} for skipped slots. */
    private List<VariableDeclaration> untypedDeclarations(SolidityParser.IdentifierListContext ctx) {
        List<VariableDeclaration> declarations = new ArrayList<>();
        for (ParseTree slot : commaSeparated(innerChildren(ctx))) {
            if (slot == null) {
                declarations.add(null);
            } else {
                if (!(slot instanceof SolidityParser.IdentifierContext)) {
                    throw new ReductionException("Expected identifier but found '" + slot.getText() + "'");
                }
                SolidityParser.IdentifierContext identifier = (SolidityParser.IdentifierContext) slot;
                declarations.add(
                        meta(
                                new VariableDeclaration(null, reduce(identifier, Identifier.class), null, false),
                                identifier));
            }
        }
        return declarations;
    }

    private List<VariableDeclaration> declarationList(SolidityParser.VariableDeclarationListContext ctx) {
        List<VariableDeclaration> declarations = new ArrayList<>();
        for (ParseTree slot : commaSeparated(allChildren(ctx))) {
            declarations.add(slot == null ? null : reduce(slot, VariableDeclaration.class));
        }
        return declarations;
    }

    @Override
    public AstNode visitVariableDeclarationList(SolidityParser.VariableDeclarationListContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitIdentifierList(SolidityParser.IdentifierListContext ctx) {
        throw folded(ctx);
    }

    // Expressions

    @Override
    public AstNode visitExpression(SolidityParser.ExpressionContext ctx) {
        List<String> children = new ArrayList<>(ctx.getChildCount());
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            children.add(child instanceof TerminalNode ? child.getText() : null);
        }
        ExpressionShape shape = ExpressionShapes.classify(children);
        if (shape == ExpressionShape.PRIMARY) {
            return reduce(ctx.primaryExpression(), AstNode.class);
        }
        return meta(reduceExpression(shape, ctx), ctx);
    }

    private AstNode reduceExpression(ExpressionShape shape, SolidityParser.ExpressionContext ctx) {
        return switch (shape) {
            case PRIMARY -> reduce(ctx.primaryExpression(), AstNode.class);
            case NEW -> new NewExpression(reduce(ctx.typeName(), TypeName.class));
            case PREFIX_UNARY -> new UnaryOperation(unaryOperator(childText(ctx, 0)), operand(ctx, 0), true);
            case POSTFIX_UNARY -> new UnaryOperation(unaryOperator(childText(ctx, 1)), operand(ctx, 0), false);
            case PARENTHESIZED -> new TupleExpression(List.of(operand(ctx, 0)), false);
            case MEMBER_ACCESS -> new MemberAccess(operand(ctx, 0), childText(ctx, 2));
            case BINARY -> new BinaryOperation(binaryOperator(childText(ctx, 1)), operand(ctx, 0), operand(ctx, 1));
            case FUNCTION_CALL -> {
                CallArguments arguments = callArguments(ctx.functionCallArguments());
                yield new FunctionCall(operand(ctx, 0), arguments.values(), arguments.names());
            }
            case INDEX_ACCESS -> new IndexAccess(operand(ctx, 0), operand(ctx, 1));
            case OPEN_RANGE -> new IndexRangeAccess(operand(ctx, 0), null, null);
            case NAME_VALUE_CALL -> new NameValueExpression(
                    operand(ctx, 0), reduce(ctx.nameValueList(), NameValueList.class));
            case CONDITIONAL -> new Conditional(operand(ctx, 0), operand(ctx, 1), operand(ctx, 2));
            case RANGE_END_ONLY -> new IndexRangeAccess(operand(ctx, 0), null, operand(ctx, 1));
            case RANGE_START_ONLY -> new IndexRangeAccess(operand(ctx, 0), operand(ctx, 1), null);
            case RANGE_BOTH -> new IndexRangeAccess(operand(ctx, 0), operand(ctx, 1), operand(ctx, 2));
        };
    }

    private Expression operand(SolidityParser.ExpressionContext ctx, int index) {
        return reduce(ctx.expression(index), Expression.class);
    }

    private static UnaryOperator unaryOperator(String symbol) {
        return UnaryOperator.fromSymbol(symbol)
                .orElseThrow(() -> new ReductionException("Unknown unary operator '" + symbol + "'"));
    }

    private static BinaryOperator binaryOperator(String symbol) {
        return BinaryOperator.fromSymbol(symbol)
                .orElseThrow(() -> new ReductionException("Unknown binary operator '" + symbol + "'"));
    }

    @Override
    public AstNode visitPrimaryExpression(SolidityParser.PrimaryExpressionContext ctx) {
        if (ctx.BooleanLiteral() != null) {
            return meta(new BooleanLiteral("true".equals(ctx.BooleanLiteral().getText())), ctx);
        }
        if (ctx.numberLiteral() != null) {
            return reduce(ctx.numberLiteral(), NumberLiteral.class);
        }
        if (ctx.hexLiteral() != null) {
            return reduce(ctx.hexLiteral(), HexLiteral.class);
        }
        if (ctx.stringLiteral() != null) {
            return reduce(ctx.stringLiteral(), StringLiteral.class);
        }
        if (ctx.identifier() != null) {
            if (ctx.getChildCount() == 3) {
                // `T[]` in expression position, e.g. `abi.decode(data, (uint[]))`
                UserDefinedTypeName baseType = meta(new UserDefinedTypeName(ctx.identifier().getText()), ctx.identifier());
                return meta(new ArrayTypeName(baseType, null), ctx);
            }
            return reduce(ctx.identifier(), Identifier.class);
        }
        if (ctx.TypeKeyword() != null) {
            return meta(new Identifier("type"), ctx);
        }
        if (ctx.PayableKeyword() != null) {
            return meta(new Identifier("payable"), ctx);
        }
        if (ctx.tupleExpression() != null) {
            return reduce(ctx.tupleExpression(), TupleExpression.class);
        }
        if (ctx.typeName() != null) {
            return reduce(ctx.typeName(), AstNode.class);
        }
        throw new ReductionException("Unrecognized primary expression '" + ctx.getText() + "'");
    }

    @Override
    public AstNode visitExpressionList(SolidityParser.ExpressionListContext ctx) {
        throw folded(ctx);
    }

    @Override
    public NameValueList visitNameValueList(SolidityParser.NameValueListContext ctx) {
        List<Identifier> identifiers = new ArrayList<>();
        List<Expression> arguments = new ArrayList<>();
        for (SolidityParser.NameValueContext nameValue : ctx.nameValue()) {
            identifiers.add(reduce(nameValue.identifier(), Identifier.class));
            arguments.add(reduce(nameValue.expression(), Expression.class));
        }
        return meta(new NameValueList(identifiers, arguments), ctx);
    }

    @Override
    public AstNode visitNameValue(SolidityParser.NameValueContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitFunctionCallArguments(SolidityParser.FunctionCallArgumentsContext ctx) {
        throw folded(ctx);
    }

    @Override
    public FunctionCall visitFunctionCall(SolidityParser.FunctionCallContext ctx) {
        CallArguments arguments = callArguments(ctx.functionCallArguments());
        return meta(
                new FunctionCall(reduce(ctx.expression(), Expression.class), arguments.values(), arguments.names()),
                ctx);
    }

    private CallArguments callArguments(SolidityParser.FunctionCallArgumentsContext ctx) {
        required(ctx, "call arguments");
        if (ctx.expressionList() != null) {
            return new CallArguments(reduceAll(ctx.expressionList().expression(), Expression.class), List.of());
        }
        List<Expression> values = new ArrayList<>();
        List<Identifier> names = new ArrayList<>();
        if (ctx.nameValueList() != null) {
            for (SolidityParser.NameValueContext nameValue : ctx.nameValueList().nameValue()) {
                values.add(reduce(nameValue.expression(), Expression.class));
                names.add(reduce(nameValue.identifier(), Identifier.class));
            }
        }
        return new CallArguments(values, names);
    }

    @Override
    public TupleExpression visitTupleExpression(SolidityParser.TupleExpressionContext ctx) {
        List<Expression> components = new ArrayList<>();
        for (ParseTree slot : commaSeparated(innerChildren(ctx))) {
            components.add(slot == null ? null : reduce(slot, Expression.class));
        }
        return meta(new TupleExpression(components, "[".equals(childText(ctx, 0))), ctx);
    }

    @Override
    public NumberLiteral visitNumberLiteral(SolidityParser.NumberLiteralContext ctx) {
        String subdenomination = ctx.getChildCount() == 2 ? childText(ctx, 1) : null;
        return meta(new NumberLiteral(childText(ctx, 0), subdenomination), ctx);
    }

    @Override
    public Identifier visitIdentifier(SolidityParser.IdentifierContext ctx) {
        return meta(new Identifier(ctx.getText()), ctx);
    }

    @Override
    public HexLiteral visitHexLiteral(SolidityParser.HexLiteralContext ctx) {
        List<String> parts = new ArrayList<>();
        for (TerminalNode fragment : ctx.HexLiteralFragment()) {
            String text = fragment.getText();
            // hex"..." or hex'...'
            parts.add(text.substring(4, text.length() - 1));
        }
        return meta(new HexLiteral(parts), ctx);
    }

    @Override
    public AstNode visitOverrideSpecifier(SolidityParser.OverrideSpecifierContext ctx) {
        throw folded(ctx);
    }

    @Override
    public StringLiteral visitStringLiteral(SolidityParser.StringLiteralContext ctx) {
        return meta(toStringLiteral(ctx), ctx);
    }

    private static StringLiteral toStringLiteral(SolidityParser.StringLiteralContext ctx) {
        List<String> parts = new ArrayList<>();
        List<Boolean> unicode = new ArrayList<>();
        for (TerminalNode fragment : ctx.StringLiteralFragment()) {
            String text = fragment.getText();
            boolean isUnicode = text.startsWith("unicode");
            if (isUnicode) {
                text = text.substring("unicode".length());
            }
            char quote = text.charAt(0);
            parts.add(unquote(text).replace("\\" + quote, String.valueOf(quote)));
            unicode.add(isUnicode);
        }
        return new StringLiteral(parts, unicode);
    }

    // Inline assembly

    @Override
    public AssemblyBlock visitAssemblyBlock(SolidityParser.AssemblyBlockContext ctx) {
        return meta(new AssemblyBlock(reduceAll(ctx.assemblyItem(), AssemblyItem.class)), ctx);
    }

    @Override
    public AstNode visitAssemblyItem(SolidityParser.AssemblyItemContext ctx) {
        if (ctx.BreakKeyword() != null) {
            return meta(new Break(), ctx);
        }
        if (ctx.ContinueKeyword() != null) {
            return meta(new Continue(), ctx);
        }
        return delegate(ctx);
    }

    @Override
    public AstNode visitAssemblyExpression(SolidityParser.AssemblyExpressionContext ctx) {
        return delegate(ctx);
    }

    @Override
    public AssemblyMemberAccess visitAssemblyMember(SolidityParser.AssemblyMemberContext ctx) {
        return meta(
                new AssemblyMemberAccess(
                        reduce(ctx.identifier(0), Identifier.class), reduce(ctx.identifier(1), Identifier.class)),
                ctx);
    }

    @Override
    public AssemblyCall visitAssemblyCall(SolidityParser.AssemblyCallContext ctx) {
        return meta(
                new AssemblyCall(childText(ctx, 0), reduceAll(ctx.assemblyExpression(), AssemblyExpression.class)),
                ctx);
    }

    @Override
    public AssemblyLocalDefinition visitAssemblyLocalDefinition(SolidityParser.AssemblyLocalDefinitionContext ctx) {
        return meta(
                new AssemblyLocalDefinition(
                        assemblyNames(ctx.assemblyIdentifierOrList()),
                        reduceOptional(ctx.assemblyExpression(), AssemblyExpression.class)),
                ctx);
    }

    @Override
    public AssemblyAssignment visitAssemblyAssignment(SolidityParser.AssemblyAssignmentContext ctx) {
        return meta(
                new AssemblyAssignment(
                        assemblyNames(ctx.assemblyIdentifierOrList()),
                        reduce(ctx.assemblyExpression(), AssemblyExpression.class)),
                ctx);
    }

    private List<AssemblyExpression> assemblyNames(SolidityParser.AssemblyIdentifierOrListContext ctx) {
        required(ctx, "assembly variable names");
        if (ctx.identifier() != null) {
            return List.of(reduce(ctx.identifier(), Identifier.class));
        }
        if (ctx.assemblyMember() != null) {
            return List.of(reduce(ctx.assemblyMember(), AssemblyMemberAccess.class));
        }
        SolidityParser.AssemblyIdentifierListContext list =
                required(ctx.assemblyIdentifierList(), "assembly identifier list");
        return reduceAll(list.identifier(), AssemblyExpression.class);
    }

    @Override
    public AstNode visitAssemblyIdentifierOrList(SolidityParser.AssemblyIdentifierOrListContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AstNode visitAssemblyIdentifierList(SolidityParser.AssemblyIdentifierListContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AssemblyStackAssignment visitAssemblyStackAssignment(SolidityParser.AssemblyStackAssignmentContext ctx) {
        return meta(
                new AssemblyStackAssignment(
                        text(ctx.identifier(), "stack assignment target"),
                        reduce(ctx.assemblyExpression(), AssemblyExpression.class)),
                ctx);
    }

    @Override
    public LabelDefinition visitLabelDefinition(SolidityParser.LabelDefinitionContext ctx) {
        return meta(new LabelDefinition(text(ctx.identifier(), "label name")), ctx);
    }

    @Override
    public AssemblySwitch visitAssemblySwitch(SolidityParser.AssemblySwitchContext ctx) {
        return meta(
                new AssemblySwitch(
                        reduce(ctx.assemblyExpression(), AssemblyExpression.class),
                        reduceAll(ctx.assemblyCase(), AssemblyCase.class)),
                ctx);
    }

    @Override
    public AssemblyCase visitAssemblyCase(SolidityParser.AssemblyCaseContext ctx) {
        AssemblyExpression value = null;
        if ("case".equals(childText(ctx, 0))) {
            value = reduce(ctx.assemblyLiteral(), AssemblyExpression.class);
        }
        return meta(new AssemblyCase(value, reduce(ctx.assemblyBlock(), AssemblyBlock.class)), ctx);
    }

    @Override
    public AssemblyFunctionDefinition visitAssemblyFunctionDefinition(
            SolidityParser.AssemblyFunctionDefinitionContext ctx) {
        SolidityParser.AssemblyIdentifierListContext arguments = ctx.assemblyIdentifierList();
        SolidityParser.AssemblyFunctionReturnsContext returns = ctx.assemblyFunctionReturns();
        return meta(
                new AssemblyFunctionDefinition(
                        text(ctx.identifier(), "assembly function name"),
                        arguments == null ? List.of() : reduceAll(arguments.identifier(), Identifier.class),
                        returns == null
                                ? List.of()
                                : reduceAll(
                                        required(returns.assemblyIdentifierList(), "assembly return list").identifier(),
                                        Identifier.class),
                        reduce(ctx.assemblyBlock(), AssemblyBlock.class)),
                ctx);
    }

    @Override
    public AstNode visitAssemblyFunctionReturns(SolidityParser.AssemblyFunctionReturnsContext ctx) {
        throw folded(ctx);
    }

    @Override
    public AssemblyFor visitAssemblyFor(SolidityParser.AssemblyForContext ctx) {
        return meta(
                new AssemblyFor(
                        reduce(child(ctx, 1), AssemblyItem.class),
                        reduce(child(ctx, 2), AssemblyExpression.class),
                        reduce(child(ctx, 3), AssemblyItem.class),
                        reduce(child(ctx, 4), AssemblyBlock.class)),
                ctx);
    }

    @Override
    public AssemblyIf visitAssemblyIf(SolidityParser.AssemblyIfContext ctx) {
        return meta(
                new AssemblyIf(
                        reduce(ctx.assemblyExpression(), AssemblyExpression.class),
                        reduce(ctx.assemblyBlock(), AssemblyBlock.class)),
                ctx);
    }

    @Override
    public AstNode visitAssemblyLiteral(SolidityParser.AssemblyLiteralContext ctx) {
        if (ctx.stringLiteral() != null) {
            return reduce(ctx.stringLiteral(), StringLiteral.class);
        }
        if (ctx.BooleanLiteral() != null) {
            return meta(new BooleanLiteral("true".equals(ctx.BooleanLiteral().getText())), ctx);
        }
        if (ctx.DecimalNumber() != null) {
            return meta(new DecimalNumber(ctx.getText()), ctx);
        }
        if (ctx.HexNumber() != null) {
            return meta(new HexNumber(ctx.getText()), ctx);
        }
        if (ctx.hexLiteral() != null) {
            return reduce(ctx.hexLiteral(), HexLiteral.class);
        }
        throw new ReductionException("Unrecognized assembly literal '" + ctx.getText() + "'");
    }

    // Plumbing

    @Override
    public AstNode visitTerminal(TerminalNode node) {
        throw new ReductionException("Unexpected token '" + node.getText() + "'");
    }

    @Override
    public AstNode visitErrorNode(ErrorNode node) {
        throw new ReductionException("Unexpected error node '" + node.getText() + "'");
    }

    private <T> T reduce(ParseTree tree, Class<T> expected) {
        if (tree == null) {
            throw new ReductionException("Missing " + expected.getSimpleName());
        }
        if (depth >= maxDepth) {
            throw new ReductionException("Nesting exceeds the maximum depth of " + maxDepth);
        }
        depth++;
        try {
            AstNode node = tree.accept(this);
            if (!expected.isInstance(node)) {
                String actual = node == null ? "nothing" : node.getType().getKindName();
                throw new ReductionException(
                        "Expected " + expected.getSimpleName() + " but reduced " + actual + " from '"
                                + tree.getText() + "'");
            }
            return expected.cast(node);
        } finally {
            depth--;
        }
    }

    private <T> T reduceOptional(ParseTree tree, Class<T> expected) {
        return tree == null ? null : reduce(tree, expected);
    }

    private <T> List<T> reduceAll(List<? extends ParseTree> trees, Class<T> expected) {
        List<T> nodes = new ArrayList<>(trees.size());
        for (ParseTree tree : trees) {
            nodes.add(reduce(tree, expected));
        }
        return nodes;
    }

    /**
     * Reduces declarations or statements. A member whose reduction fails is dropped when error recovery
     * damaged its subtree, so a tolerant parse still returns its intact siblings.
     */
    private <T> List<T> reduceMembers(List<? extends ParseTree> trees, Class<T> expected) {
        List<T> nodes = new ArrayList<>(trees.size());
        for (ParseTree tree : trees) {
            try {
                nodes.add(reduce(tree, expected));
            } catch (ReductionException ex) {
                if (!SyntaxDamage.isDamaged(tree)) {
                    throw ex;
                }
                LOGGER.log(
                        Level.FINE,
                        "Dropping {0} damaged by a syntax error: {1}",
                        new Object[] {expected.getSimpleName(), ex.getMessage()});
            }
        }
        return nodes;
    }

    private AstNode delegate(ParserRuleContext ctx) {
        return reduce(child(ctx, 0), AstNode.class);
    }

    private <T extends AstNode> T meta(T node, ParserRuleContext ctx) {
        return metadata.attach(node, ctx);
    }

    private List<VariableDeclaration> parameters(SolidityParser.ParameterListContext ctx) {
        return reduceAll(required(ctx, "parameter list").parameter(), VariableDeclaration.class);
    }

    private List<VariableDeclaration> returnParameters(SolidityParser.ReturnParametersContext ctx) {
        return ctx == null ? null : parameters(ctx.parameterList());
    }

    private List<UserDefinedTypeName> override(List<SolidityParser.OverrideSpecifierContext> specifiers) {
        if (specifiers.isEmpty()) {
            return null;
        }
        return reduceAll(specifiers.get(0).userDefinedTypeName(), UserDefinedTypeName.class);
    }

    private static String stateMutability(List<SolidityParser.StateMutabilityContext> mutabilities) {
        return mutabilities.isEmpty() ? null : mutabilities.get(0).getText();
    }

    private static String storageLocation(SolidityParser.StorageLocationContext ctx) {
        return ctx == null ? null : ctx.getText();
    }

    private static <C extends ParseTree> C required(C tree, String what) {
        if (tree == null) {
            throw new ReductionException("Missing " + what);
        }
        return tree;
    }

    private static String text(ParseTree tree, String what) {
        return required(tree, what).getText();
    }

    private static ParseTree child(ParserRuleContext ctx, int index) {
        if (index >= ctx.getChildCount()) {
            throw new ReductionException(
                    ruleName(ctx) + " has " + ctx.getChildCount() + " children, expected at least " + (index + 1));
        }
        return ctx.getChild(index);
    }

    private static String childText(ParserRuleContext ctx, int index) {
        return child(ctx, index).getText();
    }

    private static List<ParseTree> allChildren(ParserRuleContext ctx) {
        return ctx.children == null ? List.of() : ctx.children;
    }

    /** Children between the enclosing brackets. */
    private static List<ParseTree> innerChildren(ParserRuleContext ctx) {
        if (ctx.getChildCount() < 2) {
            throw new ReductionException(ruleName(ctx) + " is missing its brackets");
        }
        return ctx.children.subList(1, ctx.children.size() - 1);
    }

    /** Maps {@code a, , b} to {@code [a, null, b]}; an empty input maps to an empty list. */
    private static List<ParseTree> commaSeparated(List<ParseTree> children) {
        List<ParseTree> slots = new ArrayList<>();
        if (children.isEmpty()) {
            return slots;
        }
        boolean expectingValue = true;
        for (ParseTree child : children) {
            boolean comma = child instanceof TerminalNode && ",".equals(child.getText());
            if (expectingValue) {
                if (comma) {
                    slots.add(null);
                } else {
                    slots.add(child);
                    expectingValue = false;
                }
            } else if (comma) {
                expectingValue = true;
            } else {
                throw new ReductionException("Expected ',' but found '" + child.getText() + "'");
            }
        }
        if (expectingValue) {
            slots.add(null);
        }
        return slots;
    }

    private static String unquote(String quoted) {
        if (quoted.length() < 2) {
            throw new ReductionException("Malformed quoted text " + quoted);
        }
        return quoted.substring(1, quoted.length() - 1);
    }

    private static String ruleName(ParserRuleContext ctx) {
        return SolidityParser.ruleNames[ctx.getRuleIndex()];
    }

    private static ReductionException folded(ParserRuleContext ctx) {
        return new ReductionException(ruleName(ctx) + " is reduced by its enclosing rule");
    }

    private record CallArguments(List<Expression> values, List<Identifier> names) {}
}

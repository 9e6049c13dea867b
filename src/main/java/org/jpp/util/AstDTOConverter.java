package org.jpp.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.jpp.ast.*;
import org.jpp.dto.NodeDTO;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts an AST into plain DTOs for a JSON dump.
 */
public class AstDTOConverter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

	public static String toJson(Program program)
	{
		return GSON.toJson(toDTO(program));
	}

	public static NodeDTO toDTO(Node node)
	{
		NodeDTO dto = new NodeDTO();
		dto.kind = node.kind();

		if (node instanceof Program program)
		{
			child(dto, "statements", program.statements());
		}
		else if (node instanceof ClassDef classDef)
		{
			dto.properties.put("name", classDef.name());
			dto.properties.put("fields", classDef.fields());
			if (classDef.implementsName() != null)
			{
				dto.properties.put("implements", classDef.implementsName());
			}
			child(dto, "methods", classDef.methods());
		}
		else if (node instanceof FuncDef func)
		{
			dto.properties.put("name", func.name());
			dto.properties.put("params", func.params());
			dto.properties.put("paramTypes", func.paramTypes());
			dto.properties.put("returnType", func.returnType());
			child(dto, "body", func.body());
		}
		else if (node instanceof Return ret)
		{
			if (ret.hasValue())
			{
				child(dto, "expr", List.of(ret.expr()));
			}
		}
		else if (node instanceof Assign assign)
		{
			child(dto, "target", List.of(assign.target()));
			child(dto, "expr", List.of(assign.expr()));
		}
		else if (node instanceof IfStmt ifStmt)
		{
			child(dto, "condition", List.of(ifStmt.condition()));
			child(dto, "body", ifStmt.body());
			if (ifStmt.hasElse())
			{
				child(dto, "orElse", ifStmt.orElse());
			}
		}
		else if (node instanceof WhileStmt whileStmt)
		{
			child(dto, "condition", List.of(whileStmt.condition()));
			child(dto, "body", whileStmt.body());
		}
		else if (node instanceof ForStmt forStmt)
		{
			dto.properties.put("variable", forStmt.variable());
			child(dto, "start", List.of(forStmt.start()));
			child(dto, "end", List.of(forStmt.end()));
			child(dto, "body", forStmt.body());
		}
		else if (node instanceof Call call)
		{
			dto.properties.put("name", call.name());
			child(dto, "args", call.args());
		}
		else if (node instanceof Var var)
		{
			dto.properties.put("name", var.name());
		}
		else if (node instanceof ArrayAccess access)
		{
			dto.properties.put("array", access.array());
			child(dto, "index", List.of(access.index()));
		}
		else if (node instanceof BinOp binOp)
		{
			dto.properties.put("op", binOp.op());
			child(dto, "left", List.of(binOp.left()));
			child(dto, "right", List.of(binOp.right()));
		}
		else if (node instanceof SelectExpr select)
		{
			child(dto, "condition", List.of(select.condition()));
			child(dto, "ifTrue", List.of(select.ifTrue()));
			child(dto, "ifFalse", List.of(select.ifFalse()));
		}
		else if (node instanceof SafeNav nav)
		{
			dto.properties.put("field", nav.field());
			child(dto, "object", List.of(nav.object()));
		}
		else if (node instanceof FString fString)
		{
			child(dto, "parts", fString.parts());
		}
		else if (node instanceof IntLiteral lit)
		{
			dto.properties.put("value", lit.value());
		}
		else if (node instanceof FloatLiteral lit)
		{
			dto.properties.put("value", lit.value());
		}
		else if (node instanceof StringLiteral lit)
		{
			dto.properties.put("value", lit.value());
		}

		return dto;
	}

	private static void child(NodeDTO dto, String role, List<? extends Node> nodes)
	{
		List<NodeDTO> converted = new ArrayList<>();
		for (Node n : nodes)
		{
			converted.add(toDTO(n));
		}
		dto.children.put(role, converted);
	}
}

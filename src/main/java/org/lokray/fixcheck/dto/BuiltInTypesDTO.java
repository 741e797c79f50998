package org.lokray.fixcheck.dto;

import java.util.ArrayList;
import java.util.List;

public class BuiltInTypesDTO
{
	public List<ConstantDTO> constants = new ArrayList<>();
}

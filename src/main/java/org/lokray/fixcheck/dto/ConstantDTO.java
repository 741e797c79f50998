package org.lokray.fixcheck.dto;

public class ConstantDTO
{
	// Identifier as written in the Verilog source, e.g. "PITCH_REF_C2"
	public String name;

	// Type token, e.g. "U7F0"
	public String type;
}

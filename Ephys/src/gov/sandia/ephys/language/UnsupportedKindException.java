/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    Thrown when a renderer is handed a node kind it has no form for.
**/
@SuppressWarnings("serial")
public class UnsupportedKindException extends RuntimeException
{
    public final transient Operator op;

    public UnsupportedKindException (Operator op, String target)
    {
        super (target + " cannot render " + (op == null ? "null" : op.kind ()));
        this.op = op;
    }
}

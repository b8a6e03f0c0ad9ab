/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.c;

/**
    Floating-point type of the generated code. Selects literal suffixes and, on GPUs, function names.
**/
public enum Precision
{
    SINGLE,
    DOUBLE
}

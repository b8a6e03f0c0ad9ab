/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    Marks operators whose result is a condition rather than a general number.
    Renderers that must convert between numeric and boolean contexts test for this.
**/
public interface OperatorLogical
{
}

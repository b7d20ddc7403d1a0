package gateforge.parts;

import gateforge.StructuralException;
import java.util.OptionalInt;

/**
 * Contract shared by single parts and composite wires.
 */
public interface Connectable {

  /**
   * Returns the physical part that makes the next outgoing connection.
   * @throws StructuralException if no attachment is left and the implementation cannot grow
   */
  Part sourcePart() throws StructuralException;

  /**
   * Returns the physical part that receives an incoming connection on {@code cup}.
   * @throws StructuralException if the cup does not exist or is already used and the implementation cannot grow
   */
  Part targetPart(int cup) throws StructuralException;

  /**
   * Plugs a free attachment of this into {@code cup} of {@code target}.
   * @throws StructuralException if the cup is already used or no attachment is free
   */
  default void connect(Connectable target, int cup) throws StructuralException {
    Part to = target.targetPart(cup);
    sourcePart().plugInto(to, cup);
  }

  /** Identity assigned at finalization, empty before. */
  OptionalInt id();

  boolean isFinalized();

  /**
   * Appends this to the stack and assigns the identity.
   * @throws StructuralException if a referenced part holds no identity yet, or this was already finalized
   */
  void finalizePart(CompileStack stack) throws StructuralException;
}

package com.payment.facilitator.verification;

import com.payment.facilitator.chain.evm.EvmSignature;
import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainFamily;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.ECDSASignature;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Recovers the signer of an EIP-712 TransferWithAuthorization and compares it to the payer.
 * The token's domain name and version come from the requirement's {@code extra} map,
 * falling back to the asset entry of the network configuration.
 */
@Slf4j
@Component
public class EvmSignatureVerifier implements SignatureSchemeVerifier {

    @Override
    public ChainFamily family() {
        return ChainFamily.EVM;
    }

    @Override
    public boolean isSignedByPayer(PaymentAuthorization authorization,
                                   PaymentRequirement requirement,
                                   FacilitatorProperties.Network network) {
        EvmSignature signature = EvmSignature.parse(authorization.getSignature());
        FacilitatorProperties.Asset asset = network.findAsset(requirement.getAsset());
        String name = requirement.extraOrDefault("name", asset != null ? asset.getName() : null);
        String version = requirement.extraOrDefault("version", asset != null ? asset.getVersion() : null);
        if (name == null || version == null) {
            throw new IllegalArgumentException("No EIP-712 domain name/version known for asset " + requirement.getAsset());
        }

        byte[] digest = TransferAuthorizationTypedData.digest(authorization, name, version,
                network.getChainId(), requirement.getAsset());
        BigInteger publicKey = Sign.recoverFromSignature(signature.recoveryId(),
                new ECDSASignature(Numeric.toBigInt(signature.r()), Numeric.toBigInt(signature.s())), digest);
        if (publicKey == null) {
            return false;
        }
        String recovered = "0x" + Keys.getAddress(publicKey);
        boolean matches = recovered.equalsIgnoreCase(authorization.getPayer());
        if (!matches) {
            log.debug("Recovered signer {} does not match payer {}", recovered, authorization.getPayer().toLowerCase(Locale.ROOT));
        }
        return matches;
    }
}
